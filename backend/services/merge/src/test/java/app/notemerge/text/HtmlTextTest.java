package app.notemerge.text;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class HtmlTextTest {

    @Test
    void keepsMediaFilenamesWhenStripping() {
        assertThat(HtmlText.stripHtmlPreservingMediaFilenames("<img src='bar.jpg'>")).isEqualTo(" bar.jpg ");
        assertThat(HtmlText.stripHtmlPreservingMediaFilenames("a<audio src=\"b.mp3\"></audio>c")).isEqualTo("a b.mp3 c");
    }

    @Test
    void stripsTagsCommentsAndDecodesEntities() {
        assertThat(HtmlText.stripHtml("<b>x</b><!-- note -->&lt;y&gt; &amp;&nbsp;&#65;&#x42;"))
                .isEqualTo("x<y> & AB");
    }

    @Test
    void leavesUnknownEntitiesAlone() {
        assertThat(HtmlText.decodeEntities("&bogus; &#xZZ;")).isEqualTo("&bogus; &#xZZ;");
    }

    @Test
    void escapesAttributeText() {
        assertThat(HtmlText.escapeAttribute("a\"b'c<&>")).isEqualTo("a&quot;b&#39;c&lt;&amp;&gt;");
    }
}
