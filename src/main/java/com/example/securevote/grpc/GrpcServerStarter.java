package com.example.securevote.grpc;

import com.example.securevote.config.VoteProperties;
import io.grpc.Server;
import io.grpc.ServerBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.util.concurrent.TimeUnit;

@Component
@ConditionalOnProperty(name = "vote.audit.grpc-enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class GrpcServerStarter {

    private final VoteProperties properties;
    private final AuditGrpcService auditGrpcService;
    private Server server;

    @PostConstruct
    public void start() throws IOException {
        int port = properties.getAudit().getGrpcPort();
        server = ServerBuilder
            .forPort(port)
            .addService(auditGrpcService)
            .build()
            .start();

        log.info("Auditor gRPC server started on port: {}", port);
    }

    @PreDestroy
    public void stop() throws InterruptedException {
        if (server != null) {
            server.shutdown();
            if (!server.awaitTermination(5, TimeUnit.SECONDS)) {
                server.shutdownNow();
            }
            log.info("Auditor gRPC server stopped");
        }
    }
}
