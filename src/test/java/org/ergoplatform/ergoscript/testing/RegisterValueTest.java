package org.ergoplatform.ergoscript.testing;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.ergoplatform.ergoscript.data.Coll;
import org.ergoplatform.ergoscript.lang.SType;
import org.junit.jupiter.api.Test;

class RegisterValueTest {
    @Test
    void recognisesLiteralForms() {
        assertEquals(new RegisterValue.LongValue(100L), RegisterValue.parse("100L"));
        assertEquals(new RegisterValue.IntValue(7), RegisterValue.parse(" 7 "));
        assertEquals(new RegisterValue.BooleanValue(true), RegisterValue.parse("true"));
        assertEquals(new RegisterValue.StringValue("owner"), RegisterValue.parse("\"owner\""));
        assertEquals(new RegisterValue.BytesValue("cafe"), RegisterValue.parse("0xCAFE"));
    }

    @Test
    void keepsUnreadableTextAsString() {
        assertEquals(new RegisterValue.StringValue("0xZZ"), RegisterValue.parse("0xZZ"));
        assertEquals(new RegisterValue.StringValue("someName"), RegisterValue.parse("someName"));
    }

    @Test
    void convertsToTypedConstants() {
        var bytes = new RegisterValue.BytesValue("cafe").toConstant();
        assertEquals(SType.BYTES, bytes.type());
        assertEquals(Coll.fromHex("cafe"), bytes.value());
        assertEquals(SType.INT, new RegisterValue.IntValue(1).toConstant().type());
    }
}
