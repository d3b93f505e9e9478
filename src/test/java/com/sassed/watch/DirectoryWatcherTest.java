package com.sassed.watch;

import com.sassed.SassCompiler;
import com.sassed.config.SassOptions;
import com.sassed.config.SingleFileOptions;
import com.sassed.error.SassException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class DirectoryWatcherTest {

    @TempDir
    Path dir;

    private Path folder(String name) throws IOException {
        return Files.createDirectories(dir.resolve(name));
    }

    /**
     * Writes outside the watched folder and moves the file in, so the watcher never sees it half written.
     */
    private void drop(Path folder, String name, String content) throws IOException {
        Path staged = Files.writeString(dir.resolve(name + ".staged"), content);
        Files.move(staged, folder.resolve(name), StandardCopyOption.ATOMIC_MOVE);
    }

    private static void waitUntilClosed(DirectoryWatcher watcher) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        while (!watcher.isClosed() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
    }

    @Test
    public void testChangedFileIsCompiled() throws Exception {
        Path in = folder("in");
        Path out = folder("out");
        CountDownLatch compiled = new CountDownLatch(1);

        try (DirectoryWatcher watcher = new SassCompiler().watch(in, out, SassOptions.defaults(), new WatchListener() {
            @Override
            public void onCompiled(Path source, Path output) {
                compiled.countDown();
            }
        })) {
            drop(in, "a.scss", ".a { b: c; }");
            assertTrue(compiled.await(30, TimeUnit.SECONDS));
            assertFalse(watcher.isClosed());
        }

        assertEquals(".a {\n  b: c; }\n", Files.readString(out.resolve("a.css")));
    }

    @Test
    public void testIgnoresOtherExtensions() throws Exception {
        Path in = folder("in");
        Path out = folder("out");
        CountDownLatch compiled = new CountDownLatch(1);

        try (DirectoryWatcher watcher = new SassCompiler().watch(in, out, SassOptions.defaults(), new WatchListener() {
            @Override
            public void onCompiled(Path source, Path output) {
                compiled.countDown();
            }
        })) {
            drop(in, "notes.txt", "hello");
            drop(in, "b.scss", ".b { c: d; }");
            assertTrue(compiled.await(30, TimeUnit.SECONDS));
        }

        assertFalse(Files.exists(out.resolve("notes.css")));
        assertTrue(Files.exists(out.resolve("b.css")));
    }

    @Test
    public void testSingleFileRebuildsBundle() throws Exception {
        Path in = folder("in");
        Path out = folder("out");
        Files.writeString(in.resolve("a.scss"), ".a { x: 1; }");
        SassOptions options = SassOptions.builder().singleFile(SingleFileOptions.enabled("all")).build();
        CountDownLatch compiled = new CountDownLatch(1);

        try (DirectoryWatcher watcher = new SassCompiler().watch(in, out, options, new WatchListener() {
            @Override
            public void onCompiled(Path source, Path output) {
                compiled.countDown();
            }
        })) {
            drop(in, "b.scss", ".b { y: 2; }");
            assertTrue(compiled.await(30, TimeUnit.SECONDS));
        }

        String bundle = Files.readString(out.resolve("all.css"));
        assertTrue(bundle.contains(".a {"), bundle);
        assertTrue(bundle.contains(".b {"), bundle);
    }

    @Test
    public void testErrorHandlerCanStopWatcher() throws Exception {
        Path in = folder("in");
        Path out = folder("out");
        CountDownLatch failed = new CountDownLatch(1);

        DirectoryWatcher watcher = new SassCompiler().watch(in, out, SassOptions.defaults(), new WatchListener() {
            @Override
            public WatchAction onError(Path source, SassException error) {
                failed.countDown();
                return WatchAction.STOP;
            }
        });
        try {
            drop(in, "bad.scss", ".a { b: $missing; }");
            assertTrue(failed.await(30, TimeUnit.SECONDS));
            waitUntilClosed(watcher);
            assertTrue(watcher.isClosed());
        } finally {
            watcher.close();
        }
    }

    @Test
    public void testWatchContinuesAfterFailedCompile() throws Exception {
        Path in = folder("in");
        Path out = folder("out");
        CountDownLatch failed = new CountDownLatch(1);
        CountDownLatch compiled = new CountDownLatch(1);

        try (DirectoryWatcher watcher = new SassCompiler().watch(in, out, SassOptions.defaults(), new WatchListener() {
            @Override
            public void onCompiled(Path source, Path output) {
                compiled.countDown();
            }

            @Override
            public WatchAction onError(Path source, SassException error) {
                failed.countDown();
                return WatchAction.CONTINUE;
            }
        })) {
            drop(in, "bad.scss", ".a { b: $missing; }");
            assertTrue(failed.await(30, TimeUnit.SECONDS));
            assertFalse(watcher.isClosed());

            drop(in, "good.scss", ".g { h: i; }");
            assertTrue(compiled.await(30, TimeUnit.SECONDS));
        }

        assertEquals(".g {\n  h: i; }\n", Files.readString(out.resolve("good.css")));
        assertFalse(Files.exists(out.resolve("bad.css")));
    }

    @Test
    public void testThrowingListenerDoesNotStopDelivery() throws Exception {
        Path in = folder("in");
        Path out = folder("out");
        CountDownLatch first = new CountDownLatch(1);
        CountDownLatch second = new CountDownLatch(1);

        try (DirectoryWatcher watcher = new SassCompiler().watch(in, out, SassOptions.defaults(), new WatchListener() {
            @Override
            public void onCompiled(Path source, Path output) {
                if (source.getFileName().toString().equals("a.scss")) {
                    first.countDown();
                } else {
                    second.countDown();
                }
                throw new IllegalStateException("listener failure");
            }
        })) {
            drop(in, "a.scss", ".a { x: 1; }");
            assertTrue(first.await(30, TimeUnit.SECONDS));

            drop(in, "b.scss", ".b { y: 2; }");
            assertTrue(second.await(30, TimeUnit.SECONDS));
            assertFalse(watcher.isClosed());
        }
    }

    @Test
    public void testMissingFolderIsRejected() {
        assertThrows(SassException.class,
                () -> new SassCompiler().watch(dir.resolve("nope"), dir, SassOptions.defaults(), new WatchListener() {
                }));
    }
}
