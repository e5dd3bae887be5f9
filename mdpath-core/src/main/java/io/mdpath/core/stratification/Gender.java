package io.mdpath.core.stratification;

public enum Gender {
    M,
    F;

    public String label() {
        return name();
    }
}
