package me.golemcore.gatekeeper.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.gatekeeper.domain.model.AdminAccount;
import me.golemcore.gatekeeper.domain.model.CredentialDescriptor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;

import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

class AutoConfigurationTest {

    private GatekeeperProperties properties;
    private AutoConfiguration configuration;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        properties = new GatekeeperProperties();
        configuration = new AutoConfiguration(properties, mock(ObjectProvider.class));
    }

    @Test
    void shouldDecodeConfiguredAccount() {
        properties.getAdmin().setEmail("admin@example.com");
        properties.getAdmin().setPasswordHash("$2a$10$abcdefghijklmnopqrstuuJ6VPtk1nyQ0.OKLcM3U6n9dwmqe3L2K");
        properties.getAdmin().setTotpSecret("GEZDGNBVGY3TQOJQGEZDGNBVGY3TQOJQ");

        AdminAccount account = configuration.adminAccount();

        assertTrue(account.isConfigured());
        assertTrue(account.isTotpEnabled());
        assertInstanceOf(CredentialDescriptor.ExternalHash.class, account.getCredential());
    }

    @Test
    void shouldLeaveCredentialEmptyForUnknownFormat() {
        properties.getAdmin().setEmail("admin@example.com");
        properties.getAdmin().setPasswordHash("md5:abc");

        AdminAccount account = configuration.adminAccount();

        assertNull(account.getCredential());
        assertFalse(account.isConfigured());
    }

    @Test
    void shouldKeepCleartextDescriptorForVerifierToDecide() {
        properties.getAdmin().setEmail("admin@example.com");
        properties.getAdmin().setPasswordHash("plain:hunter2");

        AdminAccount account = configuration.adminAccount();

        assertInstanceOf(CredentialDescriptor.Cleartext.class, account.getCredential());
        assertFalse(account.isTotpEnabled());
    }

    @Test
    void shouldUseUtcClock() {
        assertEquals(ZoneOffset.UTC, AutoConfiguration.clock().getZone());
    }

    @Test
    void shouldWriteInstantsAsIsoStrings() throws Exception {
        ObjectMapper mapper = AutoConfiguration.objectMapper();

        assertEquals("\"2026-03-01T10:00:00Z\"", mapper.writeValueAsString(Instant.parse("2026-03-01T10:00:00Z")));
    }

    @Test
    void shouldIgnoreUnknownProperties() throws Exception {
        ObjectMapper mapper = AutoConfiguration.objectMapper();

        GatekeeperProperties.RuleProperties rule = mapper.readValue(
                "{\"source\":\"login\",\"unexpected\":1}", GatekeeperProperties.RuleProperties.class);

        assertEquals("login", rule.getSource());
    }
}
