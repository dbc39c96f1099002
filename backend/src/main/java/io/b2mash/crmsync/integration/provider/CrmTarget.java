package io.b2mash.crmsync.integration.provider;

import io.b2mash.crmsync.integration.CrmType;

/** One destination of a batch call: a CRM type with the credentials to reach it. */
public record CrmTarget(CrmType crmType, CrmCredentials credentials) {}
