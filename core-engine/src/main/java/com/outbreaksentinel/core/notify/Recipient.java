package com.outbreaksentinel.core.notify;

import java.io.Serializable;
import java.util.Objects;

/**
 * One resolved delivery target: a channel name and a channel-specific
 * address (webhook URL, Kafka key, log label).
 */
public class Recipient implements Serializable {

    private static final long serialVersionUID = 1L;

    private String channel;
    private String address;

    /** No-arg constructor required by Jackson. */
    public Recipient() {
    }

    public Recipient(String channel, String address) {
        this.channel = Objects.requireNonNull(channel, "channel must not be null");
        this.address = Objects.requireNonNull(address, "address must not be null");
    }

    public String getChannel() {
        return channel;
    }

    public void setChannel(String channel) {
        this.channel = channel;
    }

    public String getAddress() {
        return address;
    }

    public void setAddress(String address) {
        this.address = address;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Recipient that)) {
            return false;
        }
        return Objects.equals(channel, that.channel) && Objects.equals(address, that.address);
    }

    @Override
    public int hashCode() {
        return Objects.hash(channel, address);
    }

    @Override
    public String toString() {
        return channel + ":" + address;
    }
}
