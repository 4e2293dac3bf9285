package com.baykanat.signoff.domain.service;

import com.baykanat.signoff.api.dto.SignoffEventRequest;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/** Kontrat + kullanıcı + zaman + metod/identity/defer/engagement/event tipi için SHA-256 idempotency key üretir. */
@Service
public class IdempotencyService {

    private static final String SEPARATOR = "|";

    /** Signoff event'in kimlik key'i (64 karakter hex); signoff_events satırını tekil yapar. Notes ve is_deleted key'e girmez. */
    public String generateKey(SignoffEventRequest event) {
        String raw = String.join(SEPARATOR,
                event.getBookingContract(),
                String.valueOf(event.getDcUserId()),
                String.valueOf(event.getCreateDtm()),
                String.valueOf(event.getSignoffMethodId()),
                String.valueOf(event.getSignOffIdentityId()),
                Objects.toString(event.getDeferSignoffReasonId(), ""),
                Objects.toString(event.getDcEngagementId(), ""),
                Objects.toString(event.getSignoffEventId(), ""));

        return sha256(raw);
    }

    /**
     * Inbox key'i: kimlik key'i + is_deleted. Aynı event'in silme bildirimi canlı halinden farklı bir mesajdır,
     * inbox'ta takılmadan event satırına ulaşır.
     */
    public String generateInboxKey(SignoffEventRequest event) {
        return sha256(generateKey(event) + SEPARATOR + "deleted=" + Boolean.TRUE.equals(event.getDeleted()));
    }

    /** Girdi string'in SHA-256 hash'ini hesaplar. */
    private String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
