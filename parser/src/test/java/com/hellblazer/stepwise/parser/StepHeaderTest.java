/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 */
package com.hellblazer.stepwise.parser;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class StepHeaderTest {

    @Test
    void testHeaderFields() {
        var content = """
                      ISO-10303-21;
                      HEADER;
                      FILE_DESCRIPTION(('ViewDefinition [CoordinationView]'),'2;1');
                      FILE_NAME('house.ifc','2024-01-15T10:00:00',('','Jane'),('ACME'),'Exporter 1.2','Modeler 7','');
                      FILE_SCHEMA(('IFC2X3'));
                      ENDSEC;
                      DATA;
                      ENDSEC;
                      """;
        var header = StepHeader.parse(content);
        assertEquals("IFC2X3", header.schema());
        assertEquals("ViewDefinition [CoordinationView]", header.description());
        assertEquals("house.ifc", header.fileName());
        assertEquals("2024-01-15T10:00:00", header.timestamp());
        assertEquals("Jane", header.author());
        assertEquals("ACME", header.organization());
        assertEquals("Exporter 1.2", header.preprocessorVersion());
        assertEquals("Modeler 7", header.originatingSystem());
    }

    @Test
    void testMissingOrBrokenHeader() {
        assertEquals(StepHeader.EMPTY, StepHeader.parse("DATA;\n#1=IFCA(1);\nENDSEC;"));

        var header = StepHeader.parse("HEADER;\nFILE_NAME('a.ifc' 'b');\nFILE_SCHEMA(('IFC4'));\nENDSEC;");
        assertEquals("IFC4", header.schema());
        assertEquals("", header.fileName());
    }
}
