package com.acme.pci.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class HtmlUtilTest {

    @Test
    void escape_handlesMarkupCharacters() {
        assertEquals("&lt;b&gt;&amp;&quot;&#39;", HtmlUtil.escape("<b>&\"'"));
        assertEquals("", HtmlUtil.escape(null));
    }

    @Test
    void pre_escapesRawOutput() {
        assertEquals("<pre>An error occurred (AccessDenied) &lt;op&gt;</pre>",
                HtmlUtil.pre("An error occurred (AccessDenied) <op>"));
    }
}
