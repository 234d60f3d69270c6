/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 */
package com.hellblazer.stepwise.parser;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * @author hal.hildebrand
 */
public class StepScannerTest {

    private static List<RawEntity> scanAll(StepScanner scanner) {
        var entities = new ArrayList<RawEntity>();
        for (var next = scanner.next(); next.isPresent(); next = scanner.next()) {
            entities.add(next.get());
        }
        return entities;
    }

    @Test
    void testBasicRecords() {
        var content = "ISO-10303-21;\nHEADER;\nFILE_SCHEMA(('IFC4'));\nENDSEC;\nDATA;\n"
                      + "#1=IFCWALL('a',$);\n#2 = IFCSLAB ( 'b;c' , #1 ) ;\n#10=IFCPROJECT();\nENDSEC;\n";
        var entities = scanAll(new StepScanner(content));
        assertEquals(3, entities.size());
        var second = entities.get(1);
        assertEquals(EntityId.of(2), second.id());
        assertEquals("IFCSLAB", second.typeName());
        assertEquals(content.indexOf("#2"), second.offset());
        assertEquals("( 'b;c' , #1 )", second.arguments(content));
        assertEquals("()", entities.get(2).arguments(content));
    }

    @Test
    void testCommentsAndMissingDataSection() {
        var content = "/* leading */ #1=IFCA(1); /* between\n lines */ #2=IFCB('x''y');";
        var entities = scanAll(new StepScanner(content));
        assertEquals(2, entities.size());
        assertEquals("('x''y')", entities.get(1).arguments(content));
    }

    @Test
    void testCommentsInsideArgumentLists() {
        var content = "DATA;\n#1=IFCX(/* note; here */ 1);\n#2=IFCY(/* it's */ 'a');\n#3=IFCZ(3) /* done */ ;\n"
                      + "#4=IFCW((#1,/* ' */#2));\nENDSEC;\n";
        var entities = scanAll(new StepScanner(content));
        assertEquals(4, entities.size());
        assertEquals("(/* note; here */ 1)", entities.get(0).arguments(content));
        assertEquals("(/* it's */ 'a')", entities.get(1).arguments(content));
        assertEquals("(3)", entities.get(2).arguments(content));
        assertEquals(EntityId.of(4), entities.get(3).id());

        var model = StepModel.scan(content);
        assertEquals(1L, model.resolve(EntityId.of(1)).getInteger(0).orElseThrow());
        assertEquals("a", model.resolve(EntityId.of(2)).getString(0).orElseThrow());
        assertEquals(List.of(EntityId.of(1), EntityId.of(2)), model.resolve(EntityId.of(4)).getRefs(0));
    }

    @Test
    void testUnclosedCommentIsUnterminated() {
        var scanner = new StepScanner("DATA;\n#1=IFCA(1 /* open;\n#2=IFCB(2);\n");
        assertThrows(StepException.MalformedRecord.class, scanner::next);
        assertTrue(scanner.next().isEmpty());
    }

    @Test
    void testMalformedRecordReportsOffsetAndRecovers() {
        var content = "DATA;\n#1=IFCA(1);\n#5 IFCB(2);\n#6=IFCC(3);\nENDSEC;";
        var scanner = new StepScanner(content);
        assertEquals(EntityId.of(1), scanner.next().orElseThrow().id());
        var e = assertThrows(StepException.MalformedRecord.class, scanner::next);
        assertEquals(content.indexOf("#5"), e.getOffset());
        assertTrue(e.getFragment().startsWith("#5"));
        assertEquals(EntityId.of(6), scanner.next().orElseThrow().id());
        assertTrue(scanner.next().isEmpty());
        assertEquals(2, scanner.getScanned());
    }

    @Test
    void testMalformedWithoutSemicolonResumesAtNextRecordLine() {
        var content = "DATA;\n#1 IFCA(1)\n#2=IFCB(2);\nENDSEC;";
        var scanner = new StepScanner(content);
        assertThrows(StepException.MalformedRecord.class, scanner::next);
        assertEquals(EntityId.of(2), scanner.next().orElseThrow().id());
    }

    @Test
    void testMalformedRecovery() {
        var content = "DATA;\n#5 IFCB(#1,\n#3,#4);\n#6=IFCC(3);\nENDSEC;";
        var scanner = new StepScanner(content);
        var e = assertThrows(StepException.MalformedRecord.class, scanner::next);
        assertEquals(content.indexOf("#5"), e.getOffset());
        assertEquals(EntityId.of(6), scanner.next().orElseThrow().id());
        assertTrue(scanner.next().isEmpty());
    }

    @Test
    void testMalformedRecoverySkipsCommentedTerminator() {
        var content = "DATA;\n#5 IFCB(1 /* ; */);\n#6=IFCC(3);\nENDSEC;";
        var scanner = new StepScanner(content);
        assertThrows(StepException.MalformedRecord.class, scanner::next);
        assertEquals(EntityId.of(6), scanner.next().orElseThrow().id());
    }

    @Test
    void testIdOutOfRange() {
        var content = "DATA;\n#4294967296=IFCA(1);\n#4294967295=IFCB(2);\nENDSEC;";
        var scanner = new StepScanner(content);
        assertThrows(StepException.MalformedRecord.class, scanner::next);
        assertEquals(EntityId.MAX_VALUE, scanner.next().orElseThrow().id().value());
    }

    @Test
    void testUnterminatedRecord() {
        var scanner = new StepScanner("DATA;\n#1=IFCA('open;");
        var e = assertThrows(StepException.MalformedRecord.class, scanner::next);
        assertEquals(6, e.getOffset());
        assertTrue(scanner.next().isEmpty());
    }

    @Test
    void testProgressReporting() {
        var content = new StringBuilder("DATA;\n");
        for (int i = 1; i <= 10; i++) {
            content.append('#').append(i).append("=IFCA(").append(i).append(");\n");
        }
        content.append("ENDSEC;");
        var listener = mock(ProgressListener.class);
        var fractions = new ArrayList<Double>();
        doAnswer(invocation -> fractions.add(invocation.getArgument(1))).when(listener)
                                                                         .onProgress(eq(StepScanner.PHASE),
                                                                                     anyDouble());
        var scanner = new StepScanner(content.toString(), listener, 3);
        assertEquals(10, scanAll(scanner).size());

        verify(listener, times(4)).onProgress(eq(StepScanner.PHASE), anyDouble());
        assertEquals(1.0, fractions.get(fractions.size() - 1).doubleValue());
        for (int i = 1; i < fractions.size(); i++) {
            assertTrue(fractions.get(i) >= fractions.get(i - 1));
        }
    }

    @Test
    void testInterruptCancels() {
        var scanner = new StepScanner("DATA;\n#1=IFCA(1);\nENDSEC;");
        Thread.currentThread().interrupt();
        try {
            assertThrows(StepException.Cancelled.class, scanner::next);
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void testInvalidProgressInterval() {
        assertThrows(IllegalArgumentException.class, () -> new StepScanner("", ProgressListener.NONE, 0));
    }
}
