package com.voxpop.backend.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TextNormalizerTest {

    @Test
    void testFold() {
        assertEquals("secao eleitoral", TextNormalizer.fold("  Seção Eleitoral "));
        assertEquals("sao paulo", TextNormalizer.fold("SÃO PAULO"));
        assertEquals("", TextNormalizer.fold(null));
    }

    @Test
    void testSlugify() {
        assertEquals("saude-publica", TextNormalizer.slugify("Saúde Pública"));
        assertEquals("zona-norte-2", TextNormalizer.slugify("  Zona Norte #2! "));
        assertEquals("", TextNormalizer.slugify("!!!"));
    }
}
