package work.lcod.taskgen.compile;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class CommandTextTest {
    @Test
    void rewritesVersionFileReads() {
        assertEquals("echo ${VERSION}", CommandText.normalize("echo $(cat VERSION)"));
        assertEquals("tag ${VERSION} ${VERSION}", CommandText.normalize("tag $(cat ../VERSION) $(cat ../../VERSION)"));
    }

    @Test
    void dropsLegacyExportPrefix() {
        assertEquals(
            "skaffold build -f skaffold.yaml",
            CommandText.normalize("export VERSION=`cat VERSION` && skaffold build -f skaffold.yaml")
        );
    }

    @Test
    void unescapesDollarSigns() {
        assertEquals("echo $HOME", CommandText.normalize("echo \\$HOME"));
        assertEquals("", CommandText.unescape(null));
    }
}
