package work.marlowe.kernel.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static work.marlowe.kernel.support.ContractFixtures.resource;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.marlowe.kernel.codec.CodecException;
import work.marlowe.kernel.language.Contract;

class BundleLoaderTest {
    @Test
    void loadsJsonBundles() {
        var entries = BundleLoader.load(resource("bundles", "continuations.json"));
        assertEquals(Contract.CLOSE, entries.get("6e6f746966792d7468656e2d636c6f7365"));
    }

    @Test
    void mergesBundlesIntoOneStore() {
        var store = BundleLoader.loadAll(List.of(
            resource("bundles", "continuations.json"),
            resource("bundles", "continuations.yaml")
        ));
        assertEquals(2, store.size());
        assertInstanceOf(Contract.Pay.class, store.require("7061792d626f622d3130"));
    }

    @Test
    void rejectsBundlesThatAreNotObjects(@TempDir Path dir) throws Exception {
        var bundle = dir.resolve("bundle.json");
        Files.writeString(bundle, "[\"close\"]");
        assertThrows(CodecException.class, () -> BundleLoader.load(bundle));
    }

    @Test
    void reportsTheBrokenContinuation(@TempDir Path dir) throws Exception {
        var bundle = dir.resolve("bundle.json");
        Files.writeString(bundle, "{\"abcd\": \"open\"}");
        var error = assertThrows(CodecException.class, () -> BundleLoader.load(bundle));
        assertEquals(true, error.getMessage().contains("abcd"));
    }

    @Test
    void missingBundleFails(@TempDir Path dir) {
        assertThrows(IllegalStateException.class, () -> BundleLoader.load(dir.resolve("absent.json")));
    }
}
