package com.ewsaccount.config;

import com.ewsaccount.domain.AccessType;
import com.ewsaccount.domain.Credentials;
import com.ewsaccount.domain.FolderType;
import com.ewsaccount.domain.Protocol;
import com.ewsaccount.domain.ProtocolConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Account layer configuration properties
 */
@Data
@ConfigurationProperties(prefix = "ews")
public class AccountProperties {

    private String locale = "da_DK";
    private boolean verifySsl = true;
    private boolean autodiscover = false;
    private AccessType accessType; // null: derived from credentials

    private Endpoint endpoint = new Endpoint();
    private Auth auth = new Auth();
    private Localization localization = new Localization();

    public boolean hasCredentials() {
        return auth.getUsername() != null && !auth.getUsername().isBlank();
    }

    public Credentials toCredentials() {
        return hasCredentials() ? new Credentials(auth.getUsername(), auth.getPassword()) : null;
    }

    /**
     * Explicit protocol config, or null when autodiscovery is on
     */
    public ProtocolConfig toProtocolConfig() {
        if (autodiscover) {
            return null;
        }
        String url = endpoint.getServiceUrl();
        if (url == null || url.isBlank()) {
            return null;
        }
        return new ProtocolConfig(Protocol.builder()
                .serviceEndpoint(url)
                .version(endpoint.getVersion())
                .credentials(toCredentials())
                .verifySsl(verifySsl)
                .build());
    }

    @Data
    public static class Endpoint {
        private String serviceUrl;          // e.g. https://mail.example.com/EWS/Exchange.asmx
        private String version = "Exchange2013";
    }

    @Data
    public static class Auth {
        private String username;
        private String password;
    }

    @Data
    public static class Localization {
        /**
         * Extra localized folder names: locale -> type -> names.
         * Locale keys with '_' need brackets in YAML, e.g. "[da_DK]".
         */
        private Map<String, Map<FolderType, List<String>>> names = new HashMap<>();
    }
}
