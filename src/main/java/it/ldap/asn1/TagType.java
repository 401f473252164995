package it.ldap.asn1;

public record TagType(TagClass tagClass, Structure structure) {

    public TagType {
        if (tagClass == null || structure == null) {
            throw new IllegalArgumentException("Tag class and structure are required");
        }
    }

    public boolean constructed() {
        return structure == Structure.CONSTRUCTED;
    }
}
