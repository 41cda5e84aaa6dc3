package com.example.labyrinth;

import com.example.labyrinth.util.MapError;
import com.example.labyrinth.util.MapException;
import com.example.labyrinth.util.MapResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MapResult Tests")
public class MapResultTest {

    @Test
    @DisplayName("success carries its value and no error")
    void success() {
        MapResult<Integer> r = MapResult.success(7);
        assertTrue(r.isSuccess());
        assertFalse(r.isFailure());
        assertEquals(7, r.getValue());
        assertNull(r.getError());
        assertNull(r.getFailureMessage());
        assertEquals(14, r.map(v -> v * 2).getValue());
    }

    @Test
    @DisplayName("failure carries kind and message and refuses to give a value")
    void failure() {
        MapResult<Integer> r = MapResult.outOfBounds("off the edge");
        assertTrue(r.isFailure());
        assertEquals(MapError.Kind.OUT_OF_BOUNDS, r.getErrorKind());
        assertEquals("off the edge", r.getFailureMessage());
        assertThrows(IllegalStateException.class, r::getValue);

        MapException e = assertThrows(MapException.class, r::orElseThrow);
        assertEquals(MapError.Kind.OUT_OF_BOUNDS, e.getKind());
    }

    @Test
    @DisplayName("map and flatMap pass failures through untouched")
    void failuresPropagate() {
        MapResult<Integer> r = MapResult.shapeMismatch("wrong shape");
        MapResult<String> mapped = r.map(String::valueOf);
        MapResult<String> chained = r.flatMap(v -> MapResult.success("never"));
        MapResult<Void> propagated = r.propagate();

        assertEquals(MapError.Kind.SHAPE_MISMATCH, mapped.getErrorKind());
        assertEquals(MapError.Kind.SHAPE_MISMATCH, chained.getErrorKind());
        assertEquals("wrong shape", propagated.getFailureMessage());
        assertThrows(IllegalStateException.class, () -> MapResult.success(1).propagate());
    }

    @Test
    @DisplayName("ok is a success with no value")
    void ok() {
        assertTrue(MapResult.ok().isSuccess());
        assertNull(MapResult.ok().getValue());
        assertThrows(IllegalArgumentException.class, () -> MapResult.failure(null));
    }
}
