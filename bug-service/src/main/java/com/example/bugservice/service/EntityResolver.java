package com.example.bugservice.service;

import com.example.bugservice.entity.Application;
import com.example.bugservice.entity.Company;

/**
 * Resolves free-text application names into canonical Application and Company rows,
 * creating them on first sight. Runs inside the caller's transaction.
 */
public interface EntityResolver {

    /**
     * Find the application by name (case-insensitive), then by URL, else create it.
     * An application without an owner is linked to the resolved company.
     *
     * @param name sanitised application name
     * @param url  validated URL, or null
     */
    Application resolveApplication(String name, String url);

    /**
     * Find the company owning the domain derived from the URL (or the name), else create an unverified one.
     */
    Company resolveCompany(String appName, String appUrl);
}
