package it.ldap.network;

/**
 * {@code host[:port]} or {@code [ipv6]:port}.
 */
public record Endpoint(String host, int port) {

    public static final int LDAP_PORT = 389;
    public static final int LDAPS_PORT = 636;

    public Endpoint {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("Endpoint host is required");
        }
        if (port < 1 || port > 65_535) {
            throw new IllegalArgumentException("Invalid endpoint port: " + port);
        }
    }

    public static Endpoint parse(String endpoint, int defaultPort) {
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("Endpoint is required");
        }
        String value = endpoint.trim();
        String host;
        String port = null;
        if (value.startsWith("[")) {
            int close = value.indexOf(']');
            if (close < 0) {
                throw new IllegalArgumentException("Unterminated IPv6 literal in endpoint " + endpoint);
            }
            host = value.substring(1, close);
            if (value.length() > close + 1) {
                if (value.charAt(close + 1) != ':') {
                    throw new IllegalArgumentException("Invalid endpoint " + endpoint);
                }
                port = value.substring(close + 2);
            }
        } else {
            String[] hostPort = value.split(":", 2);
            host = hostPort[0];
            port = hostPort.length > 1 ? hostPort[1] : null;
        }

        if (port == null) {
            return new Endpoint(host, defaultPort);
        }
        try {
            return new Endpoint(host, Integer.parseInt(port));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid endpoint port in " + endpoint, ex);
        }
    }

    @Override
    public String toString() {
        return (host.indexOf(':') >= 0 ? "[" + host + "]" : host) + ":" + port;
    }
}
