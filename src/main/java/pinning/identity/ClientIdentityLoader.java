package pinning.identity;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.security.Key;
import java.security.KeyStore;
import java.security.KeyStoreException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.PrivateKey;
import java.security.UnrecoverableKeyException;
import java.security.cert.Certificate;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import javax.crypto.BadPaddingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pinning.cert.CertificateModel;
import pinning.cert.ThumbprintAlgorithm;

/**
 * Decodes the client identity from a PKCS#12 bundle, once per client.
 *
 * <p>When the container holds several private-key entries the first one in container order is used.
 * The first successful load is cached; failures are not, so the caller may retry with a corrected
 * passphrase.
 */
public class ClientIdentityLoader {
    private static final Logger log = LoggerFactory.getLogger(ClientIdentityLoader.class);

    private final ThumbprintAlgorithm thumbprintAlgorithm;
    private final Object lock = new Object();
    private final AtomicInteger decodeCount = new AtomicInteger();
    private volatile ClientIdentity cached;
    private byte[] cachedBundleDigest;

    public ClientIdentityLoader() {
        this(ThumbprintAlgorithm.SHA1);
    }

    public ClientIdentityLoader(ThumbprintAlgorithm thumbprintAlgorithm) {
        this.thumbprintAlgorithm = Objects.requireNonNull(thumbprintAlgorithm, "thumbprintAlgorithm");
    }

    public ClientIdentity load(byte[] pkcs12Bytes, char[] passphrase) throws IdentityLoadException {
        ClientIdentity identity = cached;
        if (identity != null) {
            ensureSameBundle(pkcs12Bytes);
            return identity;
        }
        synchronized (lock) {
            if (cached != null) {
                ensureSameBundle(pkcs12Bytes);
                return cached;
            }
            ClientIdentity decoded = decode(pkcs12Bytes, passphrase);
            cachedBundleDigest = bundleDigest(pkcs12Bytes);
            cached = decoded;
            log.info("Client identity loaded: {}", decoded);
            return decoded;
        }
    }

    public Optional<ClientIdentity> cached() {
        return Optional.ofNullable(cached);
    }

    public int decodeCount() {
        return decodeCount.get();
    }

    public void dispose() {
        synchronized (lock) {
            if (cached != null) {
                cached.destroy();
            }
        }
    }

    private ClientIdentity decode(byte[] pkcs12Bytes, char[] passphrase) throws IdentityLoadException {
        if (pkcs12Bytes == null || pkcs12Bytes.length == 0) {
            throw new IdentityLoadException(IdentityError.MALFORMED, "PKCS12 bundle is empty");
        }
        if (passphrase == null) {
            throw new IdentityLoadException(IdentityError.BAD_PASSPHRASE, "PKCS12 passphrase is missing");
        }
        decodeCount.incrementAndGet();

        KeyStore keyStore = openContainer(pkcs12Bytes, passphrase);
        try {
            List<String> keyAliases = privateKeyAliases(keyStore);
            if (keyAliases.isEmpty()) {
                throw new IdentityLoadException(
                    IdentityError.NO_IDENTITY,
                    "PKCS12 bundle contains no private key with a certificate chain"
                );
            }
            if (keyAliases.size() > 1) {
                log.info("PKCS12 bundle holds {} identities, using the first one ({})", keyAliases.size(),
                    keyAliases.get(0));
            }
            String alias = keyAliases.get(0);
            Key key = keyStore.getKey(alias, passphrase);
            if (!(key instanceof PrivateKey privateKey)) {
                throw new IdentityLoadException(IdentityError.NO_IDENTITY, "Entry '" + alias + "' holds no private key");
            }
            return new ClientIdentity(alias, privateKey, toModels(keyStore.getCertificateChain(alias)));
        } catch (UnrecoverableKeyException e) {
            throw new IdentityLoadException(IdentityError.BAD_PASSPHRASE, "Private key cannot be decrypted", e);
        } catch (KeyStoreException | NoSuchAlgorithmException | CertificateException e) {
            throw new IdentityLoadException(IdentityError.MALFORMED, "PKCS12 entry cannot be read", e);
        }
    }

    private KeyStore openContainer(byte[] pkcs12Bytes, char[] passphrase) throws IdentityLoadException {
        try {
            KeyStore keyStore = KeyStore.getInstance("PKCS12");
            keyStore.load(new ByteArrayInputStream(pkcs12Bytes), passphrase);
            return keyStore;
        } catch (IOException e) {
            if (isPassphraseFailure(e)) {
                throw new IdentityLoadException(
                    IdentityError.BAD_PASSPHRASE,
                    "PKCS12 passphrase is incorrect",
                    e
                );
            }
            throw new IdentityLoadException(IdentityError.MALFORMED, "PKCS12 bundle cannot be decoded", e);
        } catch (KeyStoreException | NoSuchAlgorithmException | CertificateException | RuntimeException e) {
            throw new IdentityLoadException(IdentityError.MALFORMED, "PKCS12 bundle cannot be decoded", e);
        }
    }

    private boolean isPassphraseFailure(IOException error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof UnrecoverableKeyException || t instanceof BadPaddingException) {
                return true;
            }
            String message = t.getMessage() == null ? "" : t.getMessage().toLowerCase(Locale.ROOT);
            if (message.contains("password was incorrect") || message.contains("mac invalid")) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }

    private List<String> privateKeyAliases(KeyStore keyStore) throws KeyStoreException {
        List<String> aliases = new ArrayList<>();
        Enumeration<String> enumeration = keyStore.aliases();
        while (enumeration.hasMoreElements()) {
            String alias = enumeration.nextElement();
            if (!keyStore.entryInstanceOf(alias, KeyStore.PrivateKeyEntry.class)) {
                continue;
            }
            Certificate[] chain = keyStore.getCertificateChain(alias);
            if (chain != null && chain.length > 0) {
                aliases.add(alias);
            }
        }
        return aliases;
    }

    private List<CertificateModel> toModels(Certificate[] chain) throws CertificateException {
        List<CertificateModel> models = new ArrayList<>();
        for (int i = 0; i < chain.length; i++) {
            if (!(chain[i] instanceof X509Certificate x509)) {
                throw new CertificateException("Client chain entry " + i + " is not an X.509 certificate");
            }
            models.add(CertificateModel.of(x509, i, thumbprintAlgorithm));
        }
        return models;
    }

    private void ensureSameBundle(byte[] pkcs12Bytes) {
        if (pkcs12Bytes == null || !MessageDigest.isEqual(cachedBundleDigest, bundleDigest(pkcs12Bytes))) {
            throw new IllegalStateException("A different client bundle is already loaded by this loader");
        }
    }

    private static byte[] bundleDigest(byte[] pkcs12Bytes) {
        return ThumbprintAlgorithm.SHA256.digest(pkcs12Bytes);
    }
}
