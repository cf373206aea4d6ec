package com.queryscope.analyzer.stack;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class ProjectRootTest {

    @TempDir
    Path temp;

    @Test
    void nearestAncestorWithBuildFile() throws Exception {
        Path project = Files.createDirectories(temp.resolve("shop"));
        Files.writeString(project.resolve("pom.xml"), "<project/>");
        Path nested = Files.createDirectories(project.resolve("service/src/main"));

        assertEquals(project, ProjectRoot.detect(nested));
    }

    @Test
    void gradleKotlinScriptCounts() throws Exception {
        Path project = Files.createDirectories(temp.resolve("app"));
        Files.writeString(project.resolve("build.gradle.kts"), "");

        assertEquals(project, ProjectRoot.detect(project));
    }

    @Test
    void fallsBackToStartDirectory() throws Exception {
        Path plain = Files.createDirectories(temp.resolve("a/b"));

        assertEquals(plain, ProjectRoot.detect(plain));
    }
}
