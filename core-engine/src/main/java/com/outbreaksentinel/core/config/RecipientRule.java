package com.outbreaksentinel.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Maps a location (or {@code "*"} for every location) to one recipient
 * address on one channel.
 *
 * <pre>
 * recipients:
 *   - location: ward-12
 *     address: https://hooks.example.org/ward-12
 *     channel: webhook
 * </pre>
 *
 * @since 1.0.0
 */
public class RecipientRule implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Location matched by {@link #location}, or every location. */
    public static final String ANY_LOCATION = "*";

    static final Set<String> SUPPORTED_CHANNELS = Set.of("log", "webhook", "kafka");

    private String location = ANY_LOCATION;
    private String address;
    private String channel = "log";

    public boolean appliesTo(String cellLocation) {
        return ANY_LOCATION.equals(location) || location.equalsIgnoreCase(cellLocation);
    }

    List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (location == null || location.isBlank()) {
            errors.add("Recipient requires 'location' (use \"*\" for all)");
        }
        if (address == null || address.isBlank()) {
            errors.add("Recipient for location '" + location + "' requires 'address'");
        }
        if (channel == null || !SUPPORTED_CHANNELS.contains(channel)) {
            errors.add("Recipient '" + address + "' has unknown channel '" + channel
                    + "'. Supported: " + SUPPORTED_CHANNELS);
        }
        return errors;
    }

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }

    public String getAddress() {
        return address;
    }

    public void setAddress(String address) {
        this.address = address;
    }

    public String getChannel() {
        return channel;
    }

    public void setChannel(String channel) {
        this.channel = channel != null ? channel.toLowerCase(Locale.ROOT) : null;
    }

    @Override
    public String toString() {
        return "RecipientRule{location='" + location + "', channel='" + channel + "', address='" + address + "'}";
    }
}
