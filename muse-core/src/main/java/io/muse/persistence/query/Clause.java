package io.muse.persistence.query;

public enum Clause { AND, OR }
