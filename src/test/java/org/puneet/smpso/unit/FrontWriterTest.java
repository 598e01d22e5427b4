package org.puneet.smpso.unit;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.puneet.smpso.exceptions.SwarmOptimizationException;
import org.puneet.smpso.exceptions.SwarmOptimizationException.ErrorCode;
import org.puneet.smpso.solution.FloatSolution;
import org.puneet.smpso.util.FrontWriter;

import static org.junit.jupiter.api.Assertions.*;

class FrontWriterTest {

    @TempDir
    Path tempDir;

    private static FloatSolution solution(double x0, double x1, double f0, double f1) {
        FloatSolution s = new FloatSolution(2, 2);
        s.setVariable(0, x0);
        s.setVariable(1, x1);
        s.setObjective(0, f0);
        s.setObjective(1, f1);
        return s;
    }

    @Test
    void testWritesHeaderAndRows() throws Exception {
        Path file = tempDir.resolve("nested").resolve("front.csv");
        List<FloatSolution> front = List.of(
            solution(0.0, 0.0, 0.0, 2.0),
            solution(0.5, 0.5, 0.5, 0.5));

        int written = new FrontWriter().write(front, file);

        assertEquals(2, written);
        List<String> lines = Files.readAllLines(file);
        assertEquals(3, lines.size());
        assertEquals("x0,x1,f0,f1", lines.get(0));
        assertEquals("0.0,0.0,0.0,2.0", lines.get(1));
        assertEquals("0.5,0.5,0.5,0.5", lines.get(2));
    }

    @Test
    void testEmptyFrontWritesEmptyFile() throws Exception {
        Path file = tempDir.resolve("empty.csv");

        assertEquals(0, new FrontWriter().write(new ArrayList<>(), file));
        assertTrue(Files.exists(file));
        assertTrue(Files.readAllLines(file).isEmpty());
    }

    @Test
    void testMixedShapesThrow() {
        List<FloatSolution> front = List.of(solution(0.1, 0.2, 0.3, 0.4), new FloatSolution(3, 2));
        assertThrows(IllegalArgumentException.class,
            () -> new FrontWriter().write(front, tempDir.resolve("mixed.csv")));
    }

    @Test
    void testUnwritableTargetIsReported() throws IOException {
        Path blocker = Files.createFile(tempDir.resolve("blocker"));
        Path file = blocker.resolve("front.csv");

        SwarmOptimizationException e = assertThrows(SwarmOptimizationException.class,
            () -> new FrontWriter().write(List.of(solution(0.1, 0.2, 0.3, 0.4)), file));
        assertEquals(ErrorCode.OUTPUT_FAILURE, e.getErrorCode());
        assertTrue(e.isRecoverable());
    }
}
