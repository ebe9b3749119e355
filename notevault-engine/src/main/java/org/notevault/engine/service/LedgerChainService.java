package org.notevault.engine.service;

import lombok.extern.slf4j.Slf4j;
import org.notevault.engine.config.LedgerProperties;
import org.notevault.engine.entity.LedgerEntry;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.OffsetDateTime;
import java.util.HexFormat;
import java.util.UUID;

/**
 * Hash chain over the ledger rows of one catalog entry. Each row's hash covers its own fields and
 * the previous row's hash, so editing or deleting a row breaks every later link.
 */
@Slf4j
@Service
public class LedgerChainService {

    private static final String GENESIS_SEED = "GENESIS";

    private final String algorithm;

    public LedgerChainService(LedgerProperties properties) {
        this.algorithm = properties.getAlgorithm();
    }

    public String computeGenesisHash(UUID entryId) {
        return hash(GENESIS_SEED + "|" + (entryId != null ? entryId : ""));
    }

    public String computeHash(UUID entryId, long sequence, String recipient, String documentFingerprint,
                              OffsetDateTime renderedAt, String renderFingerprint, String markId,
                              String previousHash) {
        return hash(canonicalize(entryId, sequence, recipient, documentFingerprint, renderedAt,
                renderFingerprint, markId, previousHash));
    }

    public String computeHash(LedgerEntry entry) {
        return computeHash(entry.entryId(), entry.sequence(), entry.recipient(), entry.documentFingerprint(),
                entry.renderedAt(), entry.renderFingerprint(), entry.markId(), entry.previousHash());
    }

    String canonicalize(UUID entryId, long sequence, String recipient, String documentFingerprint,
                        OffsetDateTime renderedAt, String renderFingerprint, String markId,
                        String previousHash) {
        String entryStr = entryId != null ? entryId.toString() : "";
        String recipientStr = recipient != null ? recipient : "";
        String documentStr = documentFingerprint != null ? documentFingerprint : "";
        String timestampStr = renderedAt != null ? String.valueOf(renderedAt.toInstant().toEpochMilli()) : "";
        String renderStr = renderFingerprint != null ? renderFingerprint : "";
        String markStr = markId != null ? markId : "";
        String prevHashStr = previousHash != null ? previousHash : "";

        return entryStr + "|" + sequence + "|" + recipientStr + "|" + documentStr + "|" + timestampStr
                + "|" + renderStr + "|" + markStr + "|" + prevHashStr;
    }

    private String hash(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance(algorithm);
            byte[] hashBytes = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hashBytes);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Hash algorithm not available: " + algorithm, e);
        }
    }
}
