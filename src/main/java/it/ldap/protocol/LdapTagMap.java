package it.ldap.protocol;

import java.util.Map;

/**
 * APPLICATION tag numbers of the LDAPv3 protocolOp CHOICE (RFC 4511).
 */
public final class LdapTagMap {

    public static final int BIND_REQUEST = 0;
    public static final int BIND_RESPONSE = 1;
    public static final int UNBIND_REQUEST = 2;
    public static final int SEARCH_REQUEST = 3;
    public static final int SEARCH_RESULT_ENTRY = 4;
    public static final int SEARCH_RESULT_DONE = 5;
    public static final int MODIFY_REQUEST = 6;
    public static final int MODIFY_RESPONSE = 7;
    public static final int ADD_REQUEST = 8;
    public static final int ADD_RESPONSE = 9;
    public static final int DEL_REQUEST = 10;
    public static final int DEL_RESPONSE = 11;
    public static final int MODIFY_DN_REQUEST = 12;
    public static final int MODIFY_DN_RESPONSE = 13;
    public static final int COMPARE_REQUEST = 14;
    public static final int COMPARE_RESPONSE = 15;
    public static final int ABANDON_REQUEST = 16;
    public static final int SEARCH_RESULT_REFERENCE = 19;
    public static final int EXTENDED_REQUEST = 23;
    public static final int EXTENDED_RESPONSE = 24;
    public static final int INTERMEDIATE_RESPONSE = 25;

    public static final int BIND_AUTH_SIMPLE = 0;
    public static final int MESSAGE_CONTROLS = 0;

    private static final Map<Integer, String> OPERATION_NAMES = Map.ofEntries(
        Map.entry(BIND_REQUEST, "bindRequest"),
        Map.entry(BIND_RESPONSE, "bindResponse"),
        Map.entry(UNBIND_REQUEST, "unbindRequest"),
        Map.entry(SEARCH_REQUEST, "searchRequest"),
        Map.entry(SEARCH_RESULT_ENTRY, "searchResEntry"),
        Map.entry(SEARCH_RESULT_DONE, "searchResDone"),
        Map.entry(MODIFY_REQUEST, "modifyRequest"),
        Map.entry(MODIFY_RESPONSE, "modifyResponse"),
        Map.entry(ADD_REQUEST, "addRequest"),
        Map.entry(ADD_RESPONSE, "addResponse"),
        Map.entry(DEL_REQUEST, "delRequest"),
        Map.entry(DEL_RESPONSE, "delResponse"),
        Map.entry(MODIFY_DN_REQUEST, "modDNRequest"),
        Map.entry(MODIFY_DN_RESPONSE, "modDNResponse"),
        Map.entry(COMPARE_REQUEST, "compareRequest"),
        Map.entry(COMPARE_RESPONSE, "compareResponse"),
        Map.entry(ABANDON_REQUEST, "abandonRequest"),
        Map.entry(SEARCH_RESULT_REFERENCE, "searchResRef"),
        Map.entry(EXTENDED_REQUEST, "extendedReq"),
        Map.entry(EXTENDED_RESPONSE, "extendedResp"),
        Map.entry(INTERMEDIATE_RESPONSE, "intermediateResponse")
    );

    private LdapTagMap() {
    }

    public static String operationName(long applicationNumber) {
        if (applicationNumber < 0 || applicationNumber > Integer.MAX_VALUE) {
            return "unknown[" + applicationNumber + "]";
        }
        return OPERATION_NAMES.getOrDefault((int) applicationNumber, "unknown[" + applicationNumber + "]");
    }
}
