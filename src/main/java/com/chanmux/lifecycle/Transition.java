package com.chanmux.lifecycle;

import com.chanmux.shared.model.ChannelUpdate;

import java.util.List;

public record Transition(ChannelUpdate update, List<Effect> effects) {

    public Transition {
        effects = List.copyOf(effects);
    }

    static Transition of(ChannelUpdate update, Effect... effects) {
        return new Transition(update, List.of(effects));
    }

    /** Leaves the record untouched and runs nothing. */
    static Transition none() {
        return new Transition(null, List.of());
    }

    public boolean isNone() {
        return update == null && effects.isEmpty();
    }
}
