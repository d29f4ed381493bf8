package com.example.reelfetch_backend.service;

public record SweepReport(int scanned, int deleted, int skipped, int failed) {
}
