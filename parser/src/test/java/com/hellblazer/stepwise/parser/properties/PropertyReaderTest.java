/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 */
package com.hellblazer.stepwise.parser.properties;

import com.hellblazer.stepwise.parser.EntityId;
import com.hellblazer.stepwise.parser.StepModel;
import com.hellblazer.stepwise.parser.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class PropertyReaderTest {
    private static final EntityId WALL = EntityId.of(100);
    private static final EntityId SLAB = EntityId.of(101);

    private PropertyReader reader;

    @BeforeEach
    void setUp() {
        reader = new PropertyReader(StepModel.scan(TestFixtures.simpleWall()));
    }

    @Test
    void testPropertySet() {
        var sets = reader.propertySets(WALL);
        assertEquals(1, sets.size());
        var set = sets.get(0);
        assertEquals("Pset_WallCommon", set.name());
        assertEquals(List.of(new Property("IsExternal", "true"), new Property("Width", "200", "mm"),
                             new Property("Status", "New, Approved"), new Property("Temperature", "10 - 30"),
                             new Property("Reference", "Café Wall")), set.properties());
        assertTrue(set.get("Width").orElseThrow().hasUnit());
        assertTrue(set.get("Missing").isEmpty());
        assertEquals("true", reader.property(WALL, "IsExternal").orElseThrow().value());
        assertTrue(reader.propertySets(SLAB).isEmpty());
    }

    @Test
    void testQuantitiesKeepUnknownKinds() {
        var quantities = reader.quantities(WALL);
        assertEquals(3, quantities.size());
        assertEquals(new Quantity("Length", 2000.0, "m", QuantityType.LENGTH), quantities.get(0));
        assertEquals(new Quantity("NetSideArea", 6.0, "m²", QuantityType.AREA), quantities.get(1));
        var panels = reader.quantity(WALL, "Panels").orElseThrow();
        assertEquals(QuantityType.UNTYPED, panels.type());
        assertEquals(4.0, panels.value());
        assertEquals("4", panels.formatted());
        assertEquals("6 m²", quantities.get(1).formatted());
        assertTrue(reader.quantities(SLAB).isEmpty());
    }

    @Test
    void testElementAttributes() {
        assertEquals("2O2Fr$t4X7Zf8NOew3FLOH", reader.globalId(WALL).orElseThrow());
        assertEquals("Wall 1", reader.name(WALL).orElseThrow());
        assertEquals("Exterior wall", reader.description(WALL).orElseThrow());
        assertEquals("Basic Wall", reader.objectType(WALL).orElseThrow());
        assertEquals("W-01", reader.tag(WALL).orElseThrow());
        assertTrue(reader.tag(SLAB).isEmpty());
        assertTrue(reader.name(EntityId.of(9999)).isEmpty());
        assertEquals(List.of(WALL), reader.elementsWithProperties());
    }

    @Test
    void testBoundedValueVariants() {
        var content = """
                      DATA;
                      #1=IFCWALL('w',$,'W',$,$,$,$,$,$);
                      #2=IFCPROPERTYBOUNDEDVALUE('Max',$,IFCREAL(5.5),$,$,$);
                      #3=IFCPROPERTYBOUNDEDVALUE('Min',$,$,IFCREAL(0.25),$,$);
                      #4=IFCPROPERTYBOUNDEDVALUE('None',$,$,$,$,$);
                      #5=IFCPROPERTYLISTVALUE('Layers',$,(IFCINTEGER(1),IFCINTEGER(2)),$);
                      #6=IFCPROPERTYTABLEVALUE('Table',$,$,$,$,$,$,$);
                      #7=IFCPROPERTYSET('ps',$,'Pset_Test',$,(#2,#3,#4,#5,#6));
                      #8=IFCPROPERTYSET('empty',$,'Pset_Empty',$,(#4));
                      #9=IFCRELDEFINESBYPROPERTIES('r',$,$,$,(#1),#7);
                      #10=IFCRELDEFINESBYPROPERTIES('r2',$,$,$,(#1),#8);
                      ENDSEC;
                      """;
        var reader = new PropertyReader(StepModel.scan(content));
        var sets = reader.propertySets(EntityId.of(1));
        assertEquals(1, sets.size());
        assertEquals(List.of(new Property("Max", "<= 5.5"), new Property("Min", ">= 0.25"),
                             new Property("Layers", "1, 2")), sets.get(0).properties());
    }

    @Test
    void testNumberFormatting() {
        assertEquals("0.3", PropertyReader.formatNumber(0.1 + 0.2));
        assertEquals("1.5", PropertyReader.formatNumber(1.5));
        assertEquals("2000", PropertyReader.formatNumber(2000.0));
        assertEquals("0", PropertyReader.formatNumber(-0.0000001));
        assertEquals("-12.125", PropertyReader.formatNumber(-12.125));
    }
}
