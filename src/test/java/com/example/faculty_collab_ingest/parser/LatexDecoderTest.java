package com.example.faculty_collab_ingest.parser;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class LatexDecoderTest {

    @Test
    public void testAccentCommands() {
        assertEquals("Müller", LatexDecoder.decode("M{\\\"u}ller"));
        assertEquals("André", LatexDecoder.decode("Andr\\'{e}"));
        assertEquals("François", LatexDecoder.decode("Fran\\c{c}ois"));
        assertEquals("Dvořák", LatexDecoder.decode("Dvo\\v{r}\\'{a}k"));
        assertEquals("Martí", LatexDecoder.decode("Mart{\\'\\i}"));
    }

    @Test
    public void testSpecialCharacters() {
        assertEquals("Straße", LatexDecoder.decode("Stra{\\ss}e"));
        assertEquals("Knørr", LatexDecoder.decode("Kn{\\o}rr"));
        assertEquals("Łukasz", LatexDecoder.decode("{\\L}ukasz"));
    }

    @Test
    public void testEscapesBracesAndWhitespace() {
        assertEquals("R&D 100% a_b", LatexDecoder.decode("R\\&D 100\\% a\\_b"));
        assertEquals("Deep Learning for GPUs", LatexDecoder.decode("\\emph{Deep}  Learning\n  for {GPUs}"));
        assertEquals("Foo Bar", LatexDecoder.decode("Foo~Bar"));
        assertEquals("", LatexDecoder.decode(null));
    }
}
