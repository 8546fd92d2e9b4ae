package com.chanmux.channels;

import com.chanmux.shared.model.Channel;
import com.chanmux.shared.model.ChannelUpdate;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Current status per channel id. Pure data: writes go through the lifecycle controller,
 * status queries only read.
 */
public class ChannelRegistry {

    private final Map<String, Channel> channels = new ConcurrentHashMap<>();

    public Optional<Channel> get(String channelId) {
        return Optional.ofNullable(channels.get(channelId));
    }

    /** Registers a new record. Returns false if the id is already taken. */
    public boolean register(Channel channel) {
        return channels.putIfAbsent(channel.channelId(), channel) == null;
    }

    /** Replaces the record wholesale, creating it if absent. */
    public void put(Channel channel) {
        channels.put(channel.channelId(), channel);
    }

    /**
     * Merges the update into an existing record. A removed channel stays removed:
     * returns empty when there was nothing to merge into.
     */
    public Optional<Channel> set(String channelId, ChannelUpdate update) {
        return Optional.ofNullable(channels.computeIfPresent(channelId, (id, current) -> current.merge(update)));
    }

    public Optional<Channel> remove(String channelId) {
        return Optional.ofNullable(channels.remove(channelId));
    }

    public boolean contains(String channelId) {
        return channels.containsKey(channelId);
    }

    public List<Channel> list() {
        return List.copyOf(channels.values());
    }
}
