package com.example.securevote.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReceiptVerification {
    private boolean verified;
    private String electionId;
    private String ballotHash;
    private Long castAt;

    public static ReceiptVerification notFound() {
        return new ReceiptVerification(false, null, null, null);
    }
}
