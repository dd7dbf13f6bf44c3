package dev.southwinds.source.model;

/** Directed relation between two item keys: {@code from} is the parent of {@code to}. */
public record Link(String from, String to) {}
