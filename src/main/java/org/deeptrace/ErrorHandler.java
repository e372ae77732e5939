package org.deeptrace;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public class ErrorHandler {

    /**
     * Verifica se o arquivo de mídia existe, é regular, legível e não vazio.
     *
     * @param file Caminho do arquivo.
     * @param description Descrição usada na mensagem de erro.
     * @throws MediaAccessException Se o arquivo não puder ser usado.
     */
    public static void checkMediaFile(Path file, String description) throws MediaAccessException {
        if (file == null) {
            throw new MediaAccessException(description + " não informado");
        }
        if (!Files.exists(file)) {
            throw new MediaAccessException(description + " não encontrado: " + file);
        }
        if (!Files.isRegularFile(file) || !Files.isReadable(file)) {
            throw new MediaAccessException(description + " não é um arquivo legível: " + file);
        }
        long size;
        try {
            size = Files.size(file);
        } catch (IOException e) {
            throw new MediaAccessException("Erro ao acessar " + description + ": " + file, e);
        }
        if (size == 0) {
            throw new MediaAccessException(description + " está vazio: " + file);
        }
    }

    /**
     * Valida que um valor de score está dentro de 0-100.
     */
    public static double checkScore(String name, double value) {
        if (Double.isNaN(value) || value < 0 || value > 100) {
            throw new IllegalArgumentException(name + " deve estar entre 0 e 100: " + value);
        }
        return value;
    }
}
