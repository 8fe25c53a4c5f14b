package com.leadtracker.leadtracker.pipeline;

public record SourceFile(String fileName, byte[] content) {
}
