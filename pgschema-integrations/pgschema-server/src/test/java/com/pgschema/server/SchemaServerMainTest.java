package com.pgschema.server;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SchemaServerMainTest {

    @Test
    void loadsTheGivenFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("server.properties");
        Files.writeString(file, "pgschema.server.port=9999\npgschema.jdbc.url=jdbc:h2:mem:x\n");

        Properties props = SchemaServerMain.load(file.toString());

        assertEquals("9999", props.getProperty("pgschema.server.port"));
        assertEquals("jdbc:h2:mem:x", props.getProperty("pgschema.jdbc.url"));
    }

    @Test
    void fallsBackToTheClasspath() throws Exception {
        Properties props = SchemaServerMain.load(null);
        assertEquals("/collections", props.getProperty("pgschema.server.path"));
    }

    @Test
    void missingFileFails(@TempDir Path dir) {
        assertThrows(java.io.IOException.class,
                () -> SchemaServerMain.load(dir.resolve("absent.properties").toString()));
    }
}
