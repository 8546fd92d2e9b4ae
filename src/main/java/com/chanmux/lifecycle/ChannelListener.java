package com.chanmux.lifecycle;

import com.chanmux.shared.model.Channel;

/** Observer of channel snapshot changes. Runs on the thread that applied the change; must not block. */
public interface ChannelListener {

    default void onChannelUpdated(Channel channel) {}

    default void onChannelRemoved(String channelId) {}
}
