/*
 * MIT License
 *
 * Copyright (c) 2026 Radio Recorder Authors.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package de.corelogics.radiorec.util;

import de.corelogics.radiorec.client.NormalizationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

class XmlUtilsTest {
    @Test
    void whenReadingChildText_thenOnlyLookAtDirectChildren() throws Exception {
        var root = XmlUtils.parse("<a><b><title>nested</title></b><title>  own  </title><empty> </empty></a>", "test")
            .getDocumentElement();

        assertThat(XmlUtils.childText(root, "title")).contains("own");
        assertThat(XmlUtils.childText(root, "empty")).isEmpty();
        assertThat(XmlUtils.childText(root, "missing")).isEmpty();
    }

    @Test
    void whenListingElements_thenIncludeDescendants() throws Exception {
        var root = XmlUtils.parse("<a><prog/><b><prog/></b></a>", "test").getDocumentElement();

        assertThat(XmlUtils.elements(root, "prog")).hasSize(2);
    }

    @Test
    void givenExternalEntity_thenRejectDocument() {
        var xml = "<?xml version=\"1.0\"?><!DOCTYPE a [<!ENTITY x SYSTEM \"file:///etc/passwd\">]><a>&x;</a>";

        assertThatExceptionOfType(NormalizationException.class).isThrownBy(() -> XmlUtils.parse(xml, "test"));
    }

    @Test
    void givenBrokenXml_thenFailWithOrigin() {
        assertThatExceptionOfType(NormalizationException.class)
            .isThrownBy(() -> XmlUtils.parse("<a>", "radiko"))
            .withMessageContaining("radiko");
    }
}
