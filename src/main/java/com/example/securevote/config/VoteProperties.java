package com.example.securevote.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "vote")
@Data
public class VoteProperties {
    private Duration identityTokenTtl = Duration.ofHours(168);
    private Duration ballotTokenTtl = Duration.ofHours(24);

    /**
     * Base64 AES-256 key sealing ballot choices.
     */
    private String ballotEncryptionKey;

    private int tallyPageSize = 500;
    private int lockStripes = 256;
    private Audit audit = new Audit();
    private Security security = new Security();

    @Data
    public static class Audit {
        private boolean grpcEnabled = true;
        private int grpcPort = 9090;
    }

    @Data
    public static class Security {
        private String jwtSecret;
        private Duration jwtExpiration = Duration.ofHours(24);
        private List<Operator> operators = new ArrayList<>();
    }

    @Data
    public static class Operator {
        private String username;
        private String password;
        private String role;
    }
}
