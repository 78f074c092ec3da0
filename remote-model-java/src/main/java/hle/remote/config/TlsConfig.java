package hle.remote.config;

import hle.remote.client.ConfigurationException;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Transport security settings of a {@link ConnectionInfo}.
 *
 * <p>Files are only referenced here. They are read when the credentials are
 * resolved for a concrete protocol.
 *
 * <p>Invariants checked on {@link Builder#build()}:
 * <ul>
 *   <li>mutual TLS requires both a client certificate and a client key</li>
 *   <li>a client certificate or key implies mutual TLS</li>
 * </ul>
 */
public final class TlsConfig {

    private static final TlsConfig DISABLED = builder().build();

    private final boolean enabled;
    private final boolean mutual;
    private final Path caFile;
    private final Path certFile;
    private final Path keyFile;
    private final boolean insecureVerify;

    private TlsConfig(Builder builder) {
        this.enabled = builder.enabled;
        this.mutual = builder.mutual;
        this.caFile = builder.caFile;
        this.certFile = builder.certFile;
        this.keyFile = builder.keyFile;
        this.insecureVerify = builder.insecureVerify;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Plaintext: no transport security at all.
     */
    public static TlsConfig disabled() {
        return DISABLED;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public boolean isMutual() {
        return mutual;
    }

    public Optional<Path> getCaFile() {
        return Optional.ofNullable(caFile);
    }

    public Optional<Path> getCertFile() {
        return Optional.ofNullable(certFile);
    }

    public Optional<Path> getKeyFile() {
        return Optional.ofNullable(keyFile);
    }

    /**
     * Whether verification of the server's certificate chain and host name is skipped.
     */
    public boolean isInsecureVerify() {
        return insecureVerify;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TlsConfig)) {
            return false;
        }
        TlsConfig other = (TlsConfig) o;
        return enabled == other.enabled
                && mutual == other.mutual
                && insecureVerify == other.insecureVerify
                && Objects.equals(caFile, other.caFile)
                && Objects.equals(certFile, other.certFile)
                && Objects.equals(keyFile, other.keyFile);
    }

    @Override
    public int hashCode() {
        return Objects.hash(enabled, mutual, caFile, certFile, keyFile, insecureVerify);
    }

    @Override
    public String toString() {
        if (!enabled) {
            return "TlsConfig[disabled]";
        }
        return String.format("TlsConfig[mutual=%s, ca=%s, cert=%s, key=%s, insecureVerify=%s]",
                mutual, caFile, certFile, keyFile, insecureVerify);
    }

    public static class Builder {
        private boolean enabled = false;
        private boolean mutual = false;
        private Path caFile;
        private Path certFile;
        private Path keyFile;
        private boolean insecureVerify = false;

        private Builder() {}

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        /**
         * Requests mutual TLS. Setting a client certificate or key implies it.
         */
        public Builder mutual(boolean mutual) {
            this.mutual = mutual;
            return this;
        }

        /**
         * CA bundle used to verify the server. When absent the system trust roots are used.
         */
        public Builder caFile(Path caFile) {
            this.caFile = caFile;
            return this;
        }

        public Builder certFile(Path certFile) {
            this.certFile = certFile;
            return this;
        }

        public Builder keyFile(Path keyFile) {
            this.keyFile = keyFile;
            return this;
        }

        /**
         * Skips server certificate verification. Only honored over HTTP.
         */
        public Builder insecureVerify(boolean insecureVerify) {
            this.insecureVerify = insecureVerify;
            return this;
        }

        public TlsConfig build() {
            if (certFile != null || keyFile != null) {
                mutual = true;
            }
            if (enabled && mutual && (certFile == null || keyFile == null)) {
                throw new ConfigurationException(
                    "mutual TLS requires both cert_file and key_file (cert=" + certFile + ", key=" + keyFile + ")");
            }
            return new TlsConfig(this);
        }
    }
}
