package com.ethica.lang.analysis;

/** The four analysis passes, in the order they always run. */
public enum PassName {
    ENERGY("energy"),
    ETHICS("ethics"),
    READABILITY("readability"),
    CLEVERNESS("cleverness");

    public final String id;

    PassName(String id) { this.id = id; }

    @Override
    public String toString() { return id; }
}
