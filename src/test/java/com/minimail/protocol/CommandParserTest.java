package com.minimail.protocol;

import com.minimail.pop3.Pop3Verb;
import com.minimail.smtp.SmtpVerb;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * CommandParser unit tests
 */
class CommandParserTest {

    private final CommandParser<SmtpVerb> smtp = new CommandParser<>(SmtpVerb.class, SmtpVerb.UNKNOWN);
    private final CommandParser<Pop3Verb> pop3 = new CommandParser<>(Pop3Verb.class, Pop3Verb.UNKNOWN);

    @Test
    @DisplayName("Keyword is case-insensitive, argument keeps its case")
    void testParse() {
        ParsedCommand<SmtpVerb> command = smtp.parse("mail FROM:<Alice@Example.com>\r\n");

        assertThat(command.getVerb()).isEqualTo(SmtpVerb.MAIL);
        assertThat(command.getKeyword()).isEqualTo("mail");
        assertThat(command.getArgument()).isEqualTo("FROM:<Alice@Example.com>");
        assertThat(command.hasArgument()).isTrue();
    }

    @Test
    @DisplayName("Command without argument")
    void testNoArgument() {
        ParsedCommand<Pop3Verb> command = pop3.parse("STAT\n");

        assertThat(command.getVerb()).isEqualTo(Pop3Verb.STAT);
        assertThat(command.getArgument()).isEmpty();
        assertThat(command.hasArgument()).isFalse();
    }

    @Test
    @DisplayName("Unknown and empty lines")
    void testUnknown() {
        assertThat(smtp.parse("EXPN list\r\n").getVerb()).isEqualTo(SmtpVerb.UNKNOWN);
        assertThat(smtp.parse("UNKNOWN\r\n").getVerb()).isEqualTo(SmtpVerb.UNKNOWN);
        assertThat(pop3.parse("\r\n").getKeyword()).isEmpty();
    }

    @Test
    @DisplayName("Extra whitespace around the argument is trimmed")
    void testWhitespace() {
        ParsedCommand<Pop3Verb> command = pop3.parse("  TOP   1 10  \r\n");

        assertThat(command.getVerb()).isEqualTo(Pop3Verb.TOP);
        assertThat(command.getArgument()).isEqualTo("1 10");
    }

    @Test
    @DisplayName("Only one line ending is stripped")
    void testStripLineEnding() {
        assertThat(CommandParser.stripLineEnding("abc\r\n")).isEqualTo("abc");
        assertThat(CommandParser.stripLineEnding("abc\n")).isEqualTo("abc");
        assertThat(CommandParser.stripLineEnding("abc\n\n")).isEqualTo("abc\n");
        assertThat(CommandParser.stripLineEnding("abc")).isEqualTo("abc");
    }
}
