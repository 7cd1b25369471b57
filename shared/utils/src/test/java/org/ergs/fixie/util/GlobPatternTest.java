package org.ergs.fixie.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class GlobPatternTest {

    @Test
    void starMatchesWholeKeyNotSubstring() {
        GlobPattern glob = GlobPattern.compile("*s*");
        assertThat(List.of("/as", "/wish", "/you"))
                .filteredOn(glob::matches)
                .containsExactly("/as", "/wish");
    }

    @Test
    void literalPatternRequiresFullMatch() {
        GlobPattern glob = GlobPattern.compile("/as");
        assertThat(glob.matches("/as")).isTrue();
        assertThat(glob.matches("/ask")).isFalse();
        assertThat(glob.matches("x/as")).isFalse();
    }

    @Test
    void starCrossesSeparators() {
        assertThat(GlobPattern.compile("/there/*").matches("/there/is/it")).isTrue();
    }

    @Test
    void questionMarkMatchesOneCharacter() {
        GlobPattern glob = GlobPattern.compile("/y?u");
        assertThat(glob.matches("/you")).isTrue();
        assertThat(glob.matches("/yu")).isFalse();
    }

    @Test
    void characterClassesAndNegation() {
        assertThat(GlobPattern.compile("/[aw]*").matches("/wish")).isTrue();
        assertThat(GlobPattern.compile("/[!aw]*").matches("/wish")).isFalse();
        assertThat(GlobPattern.compile("/run[0-9]").matches("/run7")).isTrue();
        assertThat(GlobPattern.compile("/run[0-9]").matches("/runx")).isFalse();
    }

    @Test
    void regexMetacharactersAreLiteral() {
        GlobPattern glob = GlobPattern.compile("/a.b+(c)");
        assertThat(glob.matches("/a.b+(c)")).isTrue();
        assertThat(glob.matches("/axbb(c)")).isFalse();
    }

    @Test
    void unterminatedClassIsMalformed() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> GlobPattern.compile("/as[x"))
                .withMessageContaining("Malformed pattern");
    }

    @Test
    void reversedRangeIsMalformed() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> GlobPattern.compile("/[z-a]"))
                .withMessageContaining("reversed range");
    }

    @Test
    void rejectsNull() {
        assertThatNullPointerException().isThrownBy(() -> GlobPattern.compile(null));
    }
}
