package com.netwarden.backend.connection.dto;

public record BatchResult(int received, int recorded, int skipped, int failed) {}
