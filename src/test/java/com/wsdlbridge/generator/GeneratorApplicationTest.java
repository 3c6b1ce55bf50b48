package com.wsdlbridge.generator;

import static org.assertj.core.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;

import io.swagger.v3.core.util.Json;
import io.swagger.v3.core.util.Yaml;

/**
 * Runs the command line end to end against the catalog fixture.
 */
class GeneratorApplicationTest {

    @TempDir
    Path tempDir;

    private static Path catalogWsdl() throws Exception {
        return Path.of(GeneratorApplicationTest.class.getResource("/wsdl/catalog/CatalogService.wsdl").toURI());
    }

    @Test
    void testConvertWritesOutputFile() throws Exception {
        Path output = tempDir.resolve("catalog.json");

        int exitCode = GeneratorApplication.execute("convert", catalogWsdl().toString(), "-o", output.toString());

        assertThat(exitCode).isZero();
        JsonNode doc = Json.mapper().readTree(Files.readString(output));
        assertThat(doc.at("/info/title").asText()).isEqualTo("CatalogService");
        assertThat(doc.at("/paths").size()).isEqualTo(2);
    }

    @Test
    void testConvertFormatIsCaseInsensitive() throws Exception {
        Path output = tempDir.resolve("catalog.yaml");

        int exitCode = GeneratorApplication.execute("convert", catalogWsdl().toString(),
                "--format", "yaml", "--output", output.toString());

        assertThat(exitCode).isZero();
        assertThat(Yaml.mapper().readTree(Files.readString(output)).get("openapi").asText()).isEqualTo("3.0.3");
    }

    @Test
    void testConvertMissingDocumentFails() {
        int exitCode = GeneratorApplication.execute("convert", tempDir.resolve("missing.wsdl").toString(),
                "-o", tempDir.resolve("out.json").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(tempDir.resolve("out.json")).doesNotExist();
    }

    @Test
    void testConvertRejectsInvalidTimeout() throws Exception {
        int exitCode = GeneratorApplication.execute("convert", catalogWsdl().toString(), "--timeout-seconds", "0");

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void testMissingSubcommandIsUsageError() {
        assertThat(GeneratorApplication.execute()).isEqualTo(2);
    }

    @Test
    void testBatchWritesDocumentsAndState() throws Exception {
        Path config = tempDir.resolve("wsdls.json");
        String location = catalogWsdl().toString().replace("\\", "\\\\");
        Files.writeString(config, "[\"" + location + "\"]", StandardCharsets.UTF_8);
        Path outDir = tempDir.resolve("generated");

        int exitCode = GeneratorApplication.execute("batch", "-c", config.toString(), "-o", outDir.toString());

        assertThat(exitCode).isZero();
        assertThat(outDir.resolve("CatalogService.openapi.json")).exists();
    }

    @Test
    void testBatchMissingConfigFails() {
        int exitCode = GeneratorApplication.execute("batch", "-c", tempDir.resolve("none.json").toString());

        assertThat(exitCode).isEqualTo(1);
    }
}
