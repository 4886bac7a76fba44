package com.studioflow.orchestrator.blob;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Locale;
import java.util.UUID;

/**
 * Filesystem blob store.
 *
 * Locators look like {@code blob://ab/ab12...ef.wav}: a two-character fan-out
 * directory plus a random name. Signed URLs point at
 * {@code {public-base-url}/{path}?exp={epochSeconds}&sig={hmac}} where the
 * HMAC-SHA256 covers {@code path + "\n" + exp}; whatever serves the files
 * verifies with {@link #verify}.
 */
@Component
public class LocalBlobStore implements BlobStore {

    private static final Logger log = LoggerFactory.getLogger(LocalBlobStore.class);

    static final String SCHEME = "blob://";

    private final Path   root;
    private final String publicBaseUrl;
    private final byte[] signingKey;
    private final Clock  clock;

    @Autowired
    public LocalBlobStore(
            @Value("${studioflow.blob-store.root}") String root,
            @Value("${studioflow.blob-store.public-base-url}") String publicBaseUrl,
            @Value("${studioflow.blob-store.signing-key}") String signingKey) {
        this(Paths.get(root), publicBaseUrl, signingKey, Clock.systemUTC());
    }

    LocalBlobStore(Path root, String publicBaseUrl, String signingKey, Clock clock) {
        this.root          = root.toAbsolutePath().normalize();
        this.publicBaseUrl = publicBaseUrl.endsWith("/")
                ? publicBaseUrl.substring(0, publicBaseUrl.length() - 1) : publicBaseUrl;
        this.signingKey    = signingKey.getBytes(StandardCharsets.UTF_8);
        this.clock         = clock;
    }

    @Override
    public String put(byte[] bytes, String contentType) {
        String name = UUID.randomUUID().toString().replace("-", "") + extensionFor(contentType);
        String path = name.substring(0, 2) + "/" + name;
        Path target = resolve(path);
        try {
            Files.createDirectories(target.getParent());
            Path tmp = Files.createTempFile(target.getParent(), ".upload-", ".tmp");
            Files.write(tmp, bytes);
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new BlobStoreException("Could not write blob " + path, e);
        }
        log.debug("Stored {} bytes as {}", bytes.length, path);
        return SCHEME + path;
    }

    @Override
    public byte[] get(String locator) {
        Path file = resolve(pathOf(locator));
        try {
            return Files.readAllBytes(file);
        } catch (IOException e) {
            throw new BlobStoreException("Could not read blob " + locator, e);
        }
    }

    @Override
    public String sign(String locator, Duration ttl) {
        String path = pathOf(locator);
        long exp = clock.instant().plus(ttl).getEpochSecond();
        return publicBaseUrl + "/" + path + "?exp=" + exp + "&sig=" + hmac(path, exp);
    }

    /** True when {@code sig} matches and {@code exp} has not passed. */
    public boolean verify(String path, long exp, String sig) {
        if (clock.instant().getEpochSecond() > exp) return false;
        return MessageDigest.isEqual(
                hmac(path, exp).getBytes(StandardCharsets.US_ASCII),
                sig.getBytes(StandardCharsets.US_ASCII));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private String hmac(String path, long exp) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(signingKey, "HmacSHA256"));
            byte[] digest = mac.doFinal((path + "\n" + exp).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (GeneralSecurityException e) {
            throw new BlobStoreException("HMAC-SHA256 unavailable", e);
        }
    }

    private static String pathOf(String locator) {
        if (locator == null || !locator.startsWith(SCHEME)) {
            throw new BlobStoreException("Not a blob locator: " + locator);
        }
        return locator.substring(SCHEME.length());
    }

    private Path resolve(String path) {
        Path p = root.resolve(path).normalize();
        if (!p.startsWith(root)) {
            throw new BlobStoreException("Blob path escapes the store root: " + path);
        }
        return p;
    }

    private static String extensionFor(String contentType) {
        if (contentType == null) return ".bin";
        return switch (contentType.toLowerCase(Locale.ROOT)) {
            case "audio/wav", "audio/x-wav" -> ".wav";
            case "audio/mpeg"               -> ".mp3";
            case "video/mp4"                -> ".mp4";
            case "application/json"         -> ".json";
            case "text/plain"               -> ".txt";
            default                         -> ".bin";
        };
    }
}
