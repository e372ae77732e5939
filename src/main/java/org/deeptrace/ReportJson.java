package org.deeptrace;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Serialização JSON do relatório e de cada seção, com nomes em snake_case.
 */
public final class ReportJson {

    private static final Logger logger = Logger.getLogger(ReportJson.class.getName());

    private static final Gson GSON = new GsonBuilder()
            .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
            .registerTypeHierarchyAdapter(Path.class, new PathAdapter())
            .serializeSpecialFloatingPointValues()
            .setPrettyPrinting()
            .create();

    private ReportJson() {
    }

    public static Gson gson() {
        return GSON;
    }

    /**
     * Qualquer seção do relatório (métricas, timeline, avaliação de ameaça...) ou o relatório inteiro.
     */
    public static String toJson(Object section) {
        return GSON.toJson(section);
    }

    /**
     * Grava {@code <video>_report.json} no diretório indicado e devolve o caminho.
     */
    public static Path write(ExplainabilityReport report, Path outputDir) throws IOException {
        Files.createDirectories(outputDir);
        Path file = outputDir.resolve(report.videoName() + "_report.json");
        Files.writeString(file, toJson(report), StandardCharsets.UTF_8);
        logger.info("💾 Relatório salvo: " + file);
        return file;
    }

    private static final class PathAdapter extends TypeAdapter<Path> {
        @Override
        public void write(JsonWriter out, Path value) throws IOException {
            if (value == null) {
                out.nullValue();
            } else {
                out.value(value.toString());
            }
        }

        @Override
        public Path read(JsonReader in) throws IOException {
            if (in.peek() == JsonToken.NULL) {
                in.nextNull();
                return null;
            }
            return Path.of(in.nextString());
        }
    }
}
