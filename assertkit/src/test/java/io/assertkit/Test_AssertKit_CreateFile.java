/*
 * Copyright 2025 The AssertKit Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.assertkit;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import org.junit.After;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests {@link AssertKit#createFile(AssertReporter, String)} and {@link AssertKit#createFile(AssertReporter, byte[])}.
 */
public class Test_AssertKit_CreateFile {
    private final List<Path> _created = new ArrayList<>();

    @After
    public void deleteCreatedFiles() throws IOException {
        for (Path path : _created) {
            Files.deleteIfExists(path);
        }
    }

    private Path track(String fileName) {
        Path path = Paths.get(fileName);
        _created.add(path);
        return path;
    }

    @Test
    public void hello_isWrittenExactly() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        AssertKit kit = AssertKit.create().withOutput(new PrintStream(out, true, StandardCharsets.UTF_8));
        AssertReporter reporter = mock(AssertReporter.class);

        Path path = track(kit.createFile(reporter, "hello"));

        Assert.assertTrue(Files.exists(path));
        Assert.assertTrue(path.isAbsolute());
        Assert.assertArrayEquals("hello".getBytes(StandardCharsets.UTF_8), Files.readAllBytes(path));
        verifyNoInteractions(reporter);
        Assert.assertEquals("No diagnostics on success.", "", out.toString(StandardCharsets.UTF_8));
    }

    @Test
    public void bytes_areWrittenExactly() throws IOException {
        byte[] content = new byte[] { 0, 1, 2, (byte) 0xFF, 10, 13 };

        Path path = track(AssertKit.create().createFile(mock(AssertReporter.class), content));

        Assert.assertArrayEquals(content, Files.readAllBytes(path));
    }

    @Test
    public void emptyContent_givesEmptyFile() throws IOException {
        Path path = track(AssertKit.create().createFile(mock(AssertReporter.class), ""));

        Assert.assertTrue(Files.exists(path));
        Assert.assertEquals(0, Files.size(path));
    }

    @Test
    public void utf8_isUsedForStrings() throws IOException {
        Path path = track(AssertKit.create().createFile(mock(AssertReporter.class), "blåbærsyltetøy"));

        Assert.assertEquals("blåbærsyltetøy", new String(Files.readAllBytes(path), StandardCharsets.UTF_8));
    }

    @Test
    public void eachCall_givesANewFile_inTempDir_withPrefix() {
        AssertKit kit = AssertKit.create().withTempFilePrefix("mytag");
        AssertReporter reporter = mock(AssertReporter.class);

        Path first = track(kit.createFile(reporter, "a"));
        Path second = track(kit.createFile(reporter, "a"));

        Assert.assertNotEquals(first, second);
        Path tmpDir = Paths.get(System.getProperty("java.io.tmpdir")).toAbsolutePath();
        Assert.assertEquals(tmpDir.normalize(), first.getParent().normalize());
        Assert.assertTrue(first.getFileName().toString().startsWith("mytag"));
    }

    @Test
    public void fileName_isPrefixAndRandomNumber_withoutSuffix() {
        Path path = track(AssertKit.create().withTempFilePrefix("mytag").createFile(mock(AssertReporter.class), "a"));

        String name = path.getFileName().toString();
        Assert.assertTrue(name, name.matches("mytag[0-9]+"));
    }

    @Test
    public void tempDirectory_isUsed() throws IOException {
        Path dir = Files.createTempDirectory("assertkit-dir");
        try {
            Path path = Paths.get(AssertKit.create().withTempDirectory(dir).createFile(mock(AssertReporter.class),
                    "in dir"));

            Assert.assertEquals(dir.toAbsolutePath(), path.getParent());
            Assert.assertEquals("in dir", Files.readString(path));
            Files.delete(path);
        }
        finally {
            Files.delete(dir);
        }
    }

    @Test
    public void createStepFails_abortsWithCause_andRestOfTestDoesNotRun() throws IOException {
        Path parent = Files.createTempDirectory("assertkit-dir");
        Path missingDir = parent.resolve("does-not-exist");
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        AssertKit kit = AssertKit.create().withTempDirectory(missingDir)
                .withOutput(new PrintStream(out, true, StandardCharsets.UTF_8));
        RecordingAssertReporter reporter = RecordingAssertReporter.create(kit);
        boolean sentinel = false;
        int line = -1;
        AssertAbortedError aborted = null;
        try {
            line = CallerLocation.here().getLineNumber() + 1;
            kit.createFile(reporter, "never written");
            sentinel = true;
        }
        catch (AssertAbortedError e) {
            aborted = e;
        }
        finally {
            Files.delete(parent);
        }

        Assert.assertFalse("The rest of the test should not run after an abort.", sentinel);
        Assert.assertNotNull("createFile should abort.", aborted);
        Assert.assertTrue(reporter.isAborted());
        Assert.assertTrue(String.valueOf(aborted.getCause()), aborted.getCause() instanceof NoSuchFileException);

        String location = "\tTest_AssertKit_CreateFile.java:" + line + ": ";
        Assert.assertEquals(location + "Expected no error creating temporary file\n"
                + location + aborted.getCause() + "\n\n", out.toString(StandardCharsets.UTF_8));
        Assert.assertEquals(location + "Expected no error creating temporary file\n"
                + location + aborted.getCause(), aborted.getMessage());
    }

    @Test
    public void defaultPrefix() {
        Path path = track(AssertKit.create().createFile(mock(AssertReporter.class), "x"));

        Assert.assertTrue(path.getFileName().toString().startsWith(AssertKit.DEFAULT_TEMP_FILE_PREFIX));
    }

    @Test
    public void viaRecordingReporter() throws IOException {
        RecordingAssertReporter reporter = RecordingAssertReporter.create();

        Path path = track(reporter.createFile("from the reporter"));

        Assert.assertEquals("from the reporter", Files.readString(path));
        Assert.assertFalse(reporter.isFailed());
    }
}
