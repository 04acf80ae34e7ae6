package com.trigger.value;

import com.trigger.exception.ValueDecodeException;
import com.trigger.exception.ValueEncodeException;
import com.trigger.lisp.FunctionValue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ValueCodec.
 */
class ValueCodecTest {

    private final ValueCodec codec = new ValueCodec();

    @Test
    @DisplayName("Encodes a value as a single-field record")
    void encodesRecord() {
        assertEquals("{\"value\":42}", codec.encode(Value.of(42)));
        assertEquals("{\"value\":\"on\"}", codec.encode(Value.of("on")));
        assertEquals("{\"value\":[1,\"a\",[true,null]]}",
                codec.encode(Value.list(Value.of(1), Value.of("a"), Value.list(Value.of(true), Value.nil()))));
    }

    @Test
    @DisplayName("Keeps integers and floats apart")
    void keepsNumericTags() {
        assertEquals(ValueType.INTEGER, codec.decode("{\"value\":3}").type());
        assertEquals(ValueType.FLOAT, codec.decode("{\"value\":3.0}").type());
        assertNotEquals(codec.decode("{\"value\":3}"), codec.decode("{\"value\":3.0}"));
    }

    @Test
    @DisplayName("Decodes records written by other tools")
    void decodesForeignRecords() {
        assertEquals(Value.list(Value.of("a"), Value.of(2.5)),
                codec.decode("{ \"value\" : [\"a\", 2.5] , \"note\": \"ignored\" }"));
        assertEquals(Value.nil(), codec.decode("{\"value\":null}"));
    }

    @Test
    @DisplayName("Rejects malformed records")
    void rejectsMalformed() {
        assertThrows(ValueDecodeException.class, () -> codec.decode("{\"value\":"));
        assertThrows(ValueDecodeException.class, () -> codec.decode("{\"other\":1}"));
        assertThrows(ValueDecodeException.class, () -> codec.decode("[1,2]"));
        assertThrows(ValueDecodeException.class, () -> codec.decode("{\"value\":{\"nested\":1}}"));
        assertThrows(ValueDecodeException.class, () -> codec.decode("{\"value\":123456789012345678901234567890}"));
    }

    @Test
    @DisplayName("Functions cannot be stored")
    void rejectsFunctions() {
        FunctionValue function = new FunctionValue("f", args -> Value.nil());

        assertThrows(ValueEncodeException.class, () -> codec.encode(function));
        assertThrows(ValueEncodeException.class, () -> codec.encode(Value.list(function)));
    }

    @Test
    @DisplayName("Non-finite floats cannot be stored")
    void rejectsNonFiniteFloats() {
        assertThrows(ValueEncodeException.class, () -> codec.encode(Value.of(Double.NaN)));
        assertThrows(ValueEncodeException.class, () -> codec.encode(Value.of(Double.POSITIVE_INFINITY)));
        assertThrows(ValueEncodeException.class, () -> codec.encode(Value.list(Value.of(Double.NEGATIVE_INFINITY))));
        assertEquals("{\"value\":1.5}", codec.encode(Value.of(1.5)));
    }
}
