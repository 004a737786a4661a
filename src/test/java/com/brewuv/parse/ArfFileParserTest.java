package com.brewuv.parse;

import com.brewuv.Fixtures;
import com.brewuv.model.AngularResponse;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ArfFileParserTest {

    @Test
    void readsConfiguredColumnAndClosesAtNinetyDegrees() throws Exception {
        AngularResponse arf = new ArfFileParser().parse(Fixtures.resource("input/instr/arf_033.dat"));

        assertArrayEquals(new double[]{0, 30, 60, 85, 90}, arf.angles(), 1e-9);
        assertArrayEquals(new double[]{1.0, 0.9, 0.7, 0.2, 0.0}, arf.values(), 1e-9);
        assertEquals(0.8, arf.valueAt(45.0), 1e-9);
    }

    @Test
    void otherColumnCanBeSelected() {
        AngularResponse arf = new ArfFileParser(1).parse("arf", "0 0.5 9\n90 0.1 9\n");

        assertArrayEquals(new double[]{0.5, 0.1}, arf.values(), 1e-9);
    }

    @Test
    void shortLinesFallBackToLastColumn() {
        AngularResponse arf = new ArfFileParser(3).parse("arf", "0 1.0\n45 0.6\n");

        assertArrayEquals(new double[]{1.0, 0.6, 0.0}, arf.values(), 1e-9);
    }

    @Test
    void firstAngleMustBeZero() {
        assertThrows(MalformedInputException.class, () -> new ArfFileParser().parse("arf", "5 0 0 1.0\n"));
    }

    @Test
    void anglesOutsideRangeAreRejected() {
        assertThrows(MalformedInputException.class, () -> new ArfFileParser().parse("arf", "0 0 0 1\n95 0 0 0\n"));
    }

    @Test
    void anglesMustIncrease() {
        assertThrows(MalformedInputException.class,
                () -> new ArfFileParser().parse("arf", "0 0 0 1\n40 0 0 0.7\n40 0 0 0.6\n"));
    }

    @Test
    void columnMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new ArfFileParser(0));
    }
}
