package com.minimail.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * AddressUtil unit tests
 */
class AddressUtilTest {

    @Test
    @DisplayName("Extract reverse-path and forward-path")
    void testExtractPath() {
        assertThat(AddressUtil.extractPath("FROM:<a@b.com>", "FROM:")).isEqualTo("a@b.com");
        assertThat(AddressUtil.extractPath("from: <a@b.com> SIZE=100", "FROM:")).isEqualTo("a@b.com");
        assertThat(AddressUtil.extractPath("TO:alice", "TO:")).isEqualTo("alice");
        assertThat(AddressUtil.extractPath("FROM:<>", "FROM:")).isEmpty();
    }

    @Test
    @DisplayName("Syntax errors give null")
    void testExtractPathInvalid() {
        assertThat(AddressUtil.extractPath("", "FROM:")).isNull();
        assertThat(AddressUtil.extractPath("TO:<a@b.com>", "FROM:")).isNull();
        assertThat(AddressUtil.extractPath("FROM:", "FROM:")).isNull();
        assertThat(AddressUtil.extractPath("FROM:<a@b.com", "FROM:")).isNull();
        assertThat(AddressUtil.extractPath(null, "FROM:")).isNull();
    }

    @Test
    @DisplayName("Local part and domain")
    void testLocalPartAndDomain() {
        assertThat(AddressUtil.extractLocalPart("alice@Example.COM")).isEqualTo("alice");
        assertThat(AddressUtil.extractDomain("alice@Example.COM")).isEqualTo("example.com");
        assertThat(AddressUtil.extractLocalPart("alice")).isEqualTo("alice");
        assertThat(AddressUtil.extractDomain("alice")).isNull();
        assertThat(AddressUtil.stripAngleBrackets(" <alice@localhost> ")).isEqualTo("alice@localhost");
    }
}
