package it.ldap.asn1;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

class TagTest {

    private static final TagClass SEQUENCE = TagClass.universal(UniversalType.SEQUENCE);

    @Test
    void shouldSumChildrenFullSizesForConstructedLength() {
        Tag small = BerPrimitives.octetString(new byte[3]);
        Tag large = BerPrimitives.octetString(new byte[200]);

        Tag sequence = Tag.constructed(SEQUENCE, small, large);

        assertEquals(5, small.size());
        assertEquals(203, large.size());
        assertEquals(208, sequence.length());
        assertEquals(1 + 2 + 208, sequence.size());
        assertEquals(Structure.CONSTRUCTED, sequence.type().structure());
        assertTrue(sequence.minimallyEncoded());
    }

    @Test
    void shouldDeriveStructureFromPayload() {
        Tag primitive = Tag.primitive(TagClass.contextSpecific(0), new byte[] {1});
        Tag empty = Tag.constructed(TagClass.application(2));

        assertEquals(Structure.PRIMITIVE, primitive.type().structure());
        assertEquals(Structure.CONSTRUCTED, empty.type().structure());
        assertEquals(0, empty.length());
        assertEquals(2, empty.size());
    }

    @Test
    void shouldRejectStructureThatDisagreesWithPayload() {
        TagType constructedType = new TagType(SEQUENCE, Structure.CONSTRUCTED);
        Payload raw = Payload.primitive(new byte[] {1, 2});

        assertThrows(IllegalArgumentException.class, () -> new Tag(constructedType, 2, raw, 4));
    }

    @Test
    void shouldRejectLengthThatDisagreesWithPayload() {
        TagType type = new TagType(TagClass.universal(UniversalType.OCTET_STRING), Structure.PRIMITIVE);

        assertThrows(IllegalArgumentException.class, () -> new Tag(type, 3, Payload.primitive(new byte[2]), 5));
        assertThrows(IllegalArgumentException.class, () -> new Tag(type, 2, Payload.primitive(new byte[2]), 3));
    }

    @Test
    void shouldNotShareCallerOwnedMemory() {
        byte[] value = new byte[] {1, 2, 3};
        List<Tag> children = new ArrayList<>();
        children.add(BerPrimitives.integer(1));

        Tag primitive = Tag.primitive(TagClass.contextSpecific(0), value);
        Tag constructed = Tag.constructed(SEQUENCE, children);
        value[0] = 9;
        children.add(BerPrimitives.integer(2));
        primitive.octets()[1] = 9;

        assertArrayEquals(new byte[] {1, 2, 3}, primitive.octets());
        assertEquals(1, constructed.children().size());
        assertThrows(UnsupportedOperationException.class, () -> constructed.children().add(BerPrimitives.nullValue()));
    }

    @Test
    void shouldCompareByValue() {
        Tag first = Tag.constructed(SEQUENCE, BerPrimitives.octetString("cn=admin"), BerPrimitives.bool(true));
        Tag second = Tag.constructed(SEQUENCE, BerPrimitives.octetString("cn=admin"), BerPrimitives.bool(true));

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
    }

    @Test
    void shouldRefuseRawOctetsOfConstructedPayload() {
        Tag sequence = Tag.constructed(SEQUENCE);

        assertThrows(IllegalStateException.class, sequence::octets);
        assertThrows(IllegalStateException.class, () -> BerPrimitives.nullValue().children());
    }
}
