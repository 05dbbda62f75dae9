package org.humspine.parser.util;

import org.humspine.parser.HumdrumFile;
import org.humspine.parser.HumdrumReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link SpineInfoDump} renderings.
 */
@Tag("unit")
class SpineInfoDumpTest {

    private HumdrumFile file;

    @BeforeEach
    void setUp() {
        file = new HumdrumReader().readString("**kern\n*^\n!! split\n4c\t4e\n*v\t*v\n*-\n");
    }

    @Test
    void spineInfo() {
        assertThat(SpineInfoDump.spineInfo(file))
                .isEqualTo("1\n1\n!! split\n(1)a\t(1)b\n(1)a\t(1)b\n1\n");
    }

    @Test
    void trackInfo() {
        assertThat(SpineInfoDump.trackInfo(file))
                .isEqualTo("1\n1\n!! split\n1.1\t1.2\n1.1\t1.2\n1\n");
    }

    @Test
    void dataTypeInfo() {
        assertThat(SpineInfoDump.dataTypeInfo(file))
                .isEqualTo("**kern\n**kern\n!! split\n**kern\t**kern\n**kern\t**kern\n**kern\n");
    }

    @Test
    void linkInfo() {
        assertThat(SpineInfoDump.linkInfo(file))
                .isEqualTo("0>1\n1>2\n!! split\n1>1\t1>1\n1>1\t1>1\n2>0\n");
    }
}
