package app.notemerge.service;

import app.notemerge.model.CardTemplate;
import app.notemerge.model.Notetype;
import app.notemerge.model.NotetypeField;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * SHA-1 over field names then template names, in order. Only structure takes part;
 * two notetypes with equal fingerprints are the same logical notetype.
 */
public final class SchemaFingerprint {

    private SchemaFingerprint() {
    }

    public static byte[] of(Notetype notetype) {
        MessageDigest digest = sha1();
        for (NotetypeField field : notetype.getFields()) {
            digest.update(field.name().getBytes(StandardCharsets.UTF_8));
        }
        for (CardTemplate template : notetype.getTemplates()) {
            digest.update(template.name().getBytes(StandardCharsets.UTF_8));
        }
        return digest.digest();
    }

    public static boolean sameSchema(Notetype a, Notetype b) {
        return MessageDigest.isEqual(of(a), of(b));
    }

    private static MessageDigest sha1() {
        try {
            return MessageDigest.getInstance("SHA-1");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }
}
