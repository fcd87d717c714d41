package com.example.bugservice.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DomainNamesTest {

    @Test
    void deriveDomain_fromUrl_usesLowerCasedHost() {
        assertThat(DomainNames.deriveDomain("https://Shop.Acme.COM/login?x=1")).isEqualTo("shop.acme.com");
        assertThat(DomainNames.deriveDomain("http://www.acme.com")).isEqualTo("www.acme.com");
    }

    @Test
    void deriveDomain_fromDottedName_stripsWww() {
        assertThat(DomainNames.deriveDomain("www.Acme.com")).isEqualTo("acme.com");
        assertThat(DomainNames.deriveDomain("acme.io")).isEqualTo("acme.io");
    }

    @Test
    void deriveDomain_fromPlainName_buildsPlaceholder() {
        assertThat(DomainNames.deriveDomain("My App")).isEqualTo("my-app.app");
        assertThat(DomainNames.deriveDomain("Acme App")).isEqualTo("acme-app.app");
    }

    @Test
    void companyNameFromUrl_titleCasesFirstLabel() {
        assertThat(DomainNames.companyNameFromUrl("https://www.acme.com/path")).isEqualTo("Acme");
        assertThat(DomainNames.companyNameFromUrl("https://globex.io")).isEqualTo("Globex");
    }

    @Test
    void isEmailFromDomain_matchesExactDomainIgnoringCase() {
        assertThat(DomainNames.isEmailFromDomain("Jane@ACME.com", "acme.com")).isTrue();
        assertThat(DomainNames.isEmailFromDomain("jane@mail.acme.com", "acme.com")).isFalse();
        assertThat(DomainNames.isEmailFromDomain("jane@globex.com", "acme.com")).isFalse();
    }

    @Test
    void isEmailFromDomain_rejectsMalformedEmails() {
        assertThat(DomainNames.isEmailFromDomain("jane.acme.com", "acme.com")).isFalse();
        assertThat(DomainNames.isEmailFromDomain("a@b@acme.com", "acme.com")).isFalse();
        assertThat(DomainNames.isEmailFromDomain(null, "acme.com")).isFalse();
    }

    @Test
    void isEmailFromDomain_placeholderDomainNeverMatches() {
        // GIVEN: a company created from a name without URL
        String domain = DomainNames.deriveDomain("My App");

        // THEN: no email can claim it, not even one on the literal placeholder domain
        assertThat(DomainNames.isEmailFromDomain("owner@my-app.app", domain)).isFalse();
        assertThat(DomainNames.isEmailFromDomain("owner@www.my-app.app", "www.my-app.app")).isFalse();
        assertThat(DomainNames.isPlaceholder(domain)).isTrue();
    }
}
