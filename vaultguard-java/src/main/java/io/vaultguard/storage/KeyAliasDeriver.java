package io.vaultguard.storage;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Maps a logical file name to the identifiers used for its key and metadata record.
 *
 * The derived id is the SHA-256 of {@code salt || qualifiedName}, where the qualified name is the
 * file name prefixed with its subdirectory ({@code dir/name}). The mapping is stable across
 * restarts as long as the salt does not change.
 */
public class KeyAliasDeriver {

    public static final String KEY_ALIAS_PREFIX = "storage_key_";
    public static final String METADATA_KEY_PREFIX = "file_meta_";

    private final byte[] salt;

    public KeyAliasDeriver() {
        this("");
    }

    public KeyAliasDeriver(String salt) {
        this.salt = salt.getBytes(StandardCharsets.UTF_8);
    }

    public DerivedKeys derive(String name) {
        return derive(name, null);
    }

    public DerivedKeys derive(String name, String directory) {
        String qualified = qualifiedName(name, directory);
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            md.update(salt);
            md.update(qualified.getBytes(StandardCharsets.UTF_8));
            String id = HexFormat.of().formatHex(md.digest());
            return new DerivedKeys(id, KEY_ALIAS_PREFIX + id, METADATA_KEY_PREFIX + id);
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException("SHA-256 not available", e);
        }
    }

    static String qualifiedName(String name, String directory) {
        return directory == null ? name : directory + "/" + name;
    }

    public record DerivedKeys(String derivedId, String keyAlias, String metadataKey) {}
}
