package it.ldap.service;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import it.ldap.network.LdapClient;
import it.ldap.network.LdapClientFactory;
import it.ldap.protocol.LdapMessage;
import it.ldap.protocol.LdapOperations;
import it.ldap.protocol.LdapResult;
import it.ldap.protocol.LdapTagMap;

/**
 * Binds to the configured directory once at startup and reports the outcome.
 */
@Component
public class LdapProbeService implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(LdapProbeService.class);

    private final LdapClientFactory clientFactory;
    private final boolean enabled;
    private final String bindDn;
    private final String password;

    public LdapProbeService(
        LdapClientFactory clientFactory,
        @Value("${ldap.probe.enabled:false}") boolean enabled,
        @Value("${ldap.probe.bind-dn:}") String bindDn,
        @Value("${ldap.probe.password:}") String password
    ) {
        this.clientFactory = clientFactory;
        this.enabled = enabled;
        this.bindDn = bindDn;
        this.password = password;
    }

    @Override
    public void run(String... args) {
        if (!enabled) {
            return;
        }
        String endpoint = args.length > 0 && StringUtils.hasText(args[0]) ? args[0] : clientFactory.getDefaultEndpoint();
        LdapResult result = probe(endpoint);
        if (result.success()) {
            logger.info("LDAP bind to {} as '{}' succeeded", endpoint, bindDn);
        } else {
            logger.warn("LDAP bind to {} as '{}' failed with result code {}: {}",
                endpoint, bindDn, result.resultCode(), result.diagnosticMessage());
        }
    }

    LdapResult probe(String endpoint) {
        try (LdapClient client = clientFactory.open(endpoint)) {
            int messageId = client.send(LdapOperations.simpleBind(bindDn, password));
            LdapMessage response = client.receive();
            if (response.messageId() != messageId || !response.isOperation(LdapTagMap.BIND_RESPONSE)) {
                throw new IllegalStateException("Expected bindResponse to message " + messageId + ", got "
                    + response.operationName() + " for message " + response.messageId());
            }
            LdapResult result = LdapResult.from(response.operation());
            client.send(LdapOperations.unbind());
            return result;
        } catch (IOException ex) {
            throw new IllegalStateException("LDAP probe failure to endpoint " + endpoint, ex);
        }
    }
}
