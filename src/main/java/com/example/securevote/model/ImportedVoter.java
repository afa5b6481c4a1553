package com.example.securevote.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A voter created by an import. The identity token is returned exactly once, for the
 * notification layer to deliver; it is never persisted in raw form.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ImportedVoter {
    private String voterId;
    private String identityToken;
    private long expiresAt;
}
