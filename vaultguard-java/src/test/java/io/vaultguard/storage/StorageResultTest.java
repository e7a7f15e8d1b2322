package io.vaultguard.storage;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("StorageResult")
class StorageResultTest {

    @Nested
    @DisplayName("Success")
    class SuccessTests {

        @Test
        @DisplayName("should expose the value")
        void value() {
            StorageResult<String> result = StorageResult.success("ok");

            assertTrue(result.isSuccess());
            assertFalse(result.isFailure());
            assertEquals("ok", result.value());
            assertEquals("ok", result.toOptional().orElseThrow());
            assertThrows(IllegalStateException.class, result::error);
        }

        @Test
        @DisplayName("should map the value")
        void map() {
            assertEquals(StorageResult.success(2), StorageResult.success("ab").map(String::length));
        }

        @Test
        @DisplayName("should compare file data by content")
        void fileDataEquality() {
            StorageResult<FileData> a = StorageResult.success(new FileData("report", new byte[] {1, 2, 3}));
            StorageResult<FileData> b = StorageResult.success(new FileData("report", new byte[] {1, 2, 3}));

            assertEquals(a, b);
            assertEquals(a.hashCode(), b.hashCode());
            assertNotEquals(a, StorageResult.success(new FileData("report", new byte[] {1, 2, 4})));
            assertNotEquals(a, StorageResult.success(new FileData("other", new byte[] {1, 2, 3})));
        }
    }

    @Nested
    @DisplayName("Failure")
    class FailureTests {

        @Test
        @DisplayName("should expose the error")
        void error() {
            IOException cause = new IOException("disk");
            StorageResult<String> result = StorageResult.failure(StorageError.Kind.IO_FAILURE, "write failed", cause);

            assertTrue(result.isFailure());
            assertTrue(result.is(StorageError.Kind.IO_FAILURE));
            assertFalse(result.is(StorageError.Kind.NOT_FOUND));
            assertSame(cause, result.error().cause());
            assertTrue(result.toOptional().isEmpty());
            assertThrows(IllegalStateException.class, result::value);
        }

        @Test
        @DisplayName("should carry the error through map")
        void mapKeepsError() {
            StorageResult<String> failed = StorageResult.failure(StorageError.notFound("missing"));

            StorageResult<Integer> mapped = failed.map(String::length);

            assertTrue(mapped.is(StorageError.Kind.NOT_FOUND));
            assertEquals("missing", mapped.error().message());
        }

        @Test
        @DisplayName("should describe kind and message")
        void describe() {
            assertEquals("Failure[VALIDATION_FAILURE: bad name]",
                StorageResult.failure(StorageError.validation("bad name")).toString());
        }
    }
}
