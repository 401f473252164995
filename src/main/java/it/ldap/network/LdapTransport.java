package it.ldap.network;

import java.io.IOException;

public interface LdapTransport {

    LdapConnection connect(String endpoint) throws IOException;
}
