package com.foresight.core.model;

import java.io.Serializable;

public record ExampleMessage(String speaker, String text) implements Serializable {}
