package fr.lapetina.multiprovider.domain.model;

import fr.lapetina.multiprovider.domain.exception.InvalidEndpointAddressException;
import fr.lapetina.multiprovider.domain.exception.ProtocolNotSupportedException;

import java.io.IOException;
import java.net.URI;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A validated endpoint address together with its metric label.
 *
 * The label never contains the path, query or credentials of the address: an IP
 * literal (with optional port) is kept verbatim, a DNS name is collapsed to its two
 * highest labels ({@code eth-mainnet.alchemy.com/v2/key -> alchemy.com}).
 */
public final class EndpointAddress {

    public static final Set<String> SUPPORTED_SCHEMES = Set.of("http", "https");

    private static final Pattern SCHEME_PREFIX = Pattern.compile("^[a-z][a-z0-9+.-]*://");
    private static final Pattern IPV4_WITH_PORT = Pattern.compile("^(\\d{1,3}\\.){3}\\d{1,3}(:\\d+)?$");
    private static final Pattern IPV6_WITH_PORT = Pattern.compile("^\\[[0-9a-f:.]+](:\\d+)?$");
    private static final int MAX_REDACTED_CAUSES = 8;

    private static final Pattern DNS_LABEL = Pattern.compile("^[a-z0-9]([a-z0-9-]*[a-z0-9])?$");

    private final URI uri;
    private final String label;

    private EndpointAddress(URI uri, String label) {
        this.uri = uri;
        this.label = label;
    }

    /**
     * Validates and parses an address of the form {@code scheme://host[:port][/path]}.
     *
     * @throws ProtocolNotSupportedException   if the scheme is not http or https
     * @throws InvalidEndpointAddressException if the address cannot be parsed or labelled
     */
    public static EndpointAddress parse(String address) {
        if (address == null || address.isBlank()) {
            throw new InvalidEndpointAddressException("Endpoint address is empty");
        }
        String trimmed = address.trim();
        int separator = trimmed.indexOf("://");
        if (separator <= 0) {
            throw new InvalidEndpointAddressException("Endpoint address has no scheme");
        }
        String scheme = trimmed.substring(0, separator).toLowerCase(Locale.ROOT);
        if (!SUPPORTED_SCHEMES.contains(scheme)) {
            throw new ProtocolNotSupportedException(scheme);
        }

        URI uri;
        try {
            uri = URI.create(trimmed);
        } catch (IllegalArgumentException e) {
            throw new InvalidEndpointAddressException("Endpoint address is not a valid URI", e);
        }
        if (uri.getHost() == null) {
            throw new InvalidEndpointAddressException("Endpoint address has no host");
        }
        return new EndpointAddress(uri, normalizeLabel(trimmed));
    }

    /**
     * Collapses an address to a bounded-cardinality provider label.
     * Accepts addresses with or without a scheme.
     *
     * @throws InvalidEndpointAddressException if the host is neither an IP literal nor a dotted DNS name
     */
    public static String normalizeLabel(String address) {
        String value = address.trim().toLowerCase(Locale.ROOT);
        value = SCHEME_PREFIX.matcher(value).replaceFirst("");

        int slash = value.indexOf('/');
        String authority = slash >= 0 ? value.substring(0, slash) : value;
        int at = authority.lastIndexOf('@');
        if (at >= 0) {
            authority = authority.substring(at + 1);
        }

        if (IPV4_WITH_PORT.matcher(authority).matches() || IPV6_WITH_PORT.matcher(authority).matches()) {
            return authority;
        }

        int colon = authority.indexOf(':');
        String hostname = colon >= 0 ? authority.substring(0, colon) : authority;
        String[] parts = hostname.split("\\.");
        if (parts.length >= 2 && allLabelsValid(parts)) {
            return parts[parts.length - 2] + "." + parts[parts.length - 1];
        }
        throw new InvalidEndpointAddressException(
                "Unhandled hostname format. Hostname must be either an IP address or a valid provider address");
    }

    private static boolean allLabelsValid(String[] parts) {
        for (String part : parts) {
            if (!DNS_LABEL.matcher(part).matches()) {
                return false;
            }
        }
        return true;
    }

    public URI getUri() {
        return uri;
    }

    public String getScheme() {
        return uri.getScheme().toLowerCase(Locale.ROOT);
    }

    /**
     * Normalized provider label, safe to expose in metrics and logs.
     */
    public String getLabel() {
        return label;
    }

    /**
     * Replaces every occurrence of the full address in a message with {@code ****}.
     * Vendor URLs often embed API keys in the path.
     */
    public String redact(String message) {
        if (message == null) {
            return null;
        }
        String full = uri.toString();
        String redacted = message.replace(full, "****");
        if (full.endsWith("/")) {
            redacted = redacted.replace(full.substring(0, full.length() - 1), "****");
        }
        return redacted;
    }

    /**
     * Copies an exception chain with every message passed through {@link #redact(String)}.
     * Each copy records the original class name in its message and keeps the original
     * stack trace. Suppressed exceptions are not copied.
     */
    public IOException redact(Throwable error) {
        return redactedCopy(error, 0);
    }

    private IOException redactedCopy(Throwable error, int depth) {
        String message = error.getMessage() != null
                ? error.getClass().getName() + ": " + redact(error.getMessage())
                : error.getClass().getName();
        IOException copy = new IOException(message);
        copy.setStackTrace(error.getStackTrace());
        Throwable cause = error.getCause();
        if (cause != null && cause != error && depth < MAX_REDACTED_CAUSES) {
            copy.initCause(redactedCopy(cause, depth + 1));
        }
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EndpointAddress that = (EndpointAddress) o;
        return uri.equals(that.uri);
    }

    @Override
    public int hashCode() {
        return Objects.hash(uri);
    }

    @Override
    public String toString() {
        return "EndpointAddress{" +
                "label='" + label + '\'' +
                '}';
    }
}
