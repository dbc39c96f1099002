package io.b2mash.crmsync.integration;

public record CredentialValidationResult(String crmType, boolean valid, String message) {}
