package com.ingestmanager.ingestmanager.source;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DataFetcherRegistryTest {

    @Test
    void shouldResolveSourcesCaseInsensitively() {
        MockTransactionFetcher mock = new MockTransactionFetcher();
        CsvFileDataFetcher csv = new CsvFileDataFetcher();
        DataFetcherRegistry registry = new DataFetcherRegistry(List.of(mock, csv));

        assertSame(mock, registry.resolve("MOCK"));
        assertSame(csv, registry.resolve(" csv "));
    }

    @Test
    void shouldListAvailableSourcesForUnknownName() {
        DataFetcherRegistry registry = new DataFetcherRegistry(List.of(new MockTransactionFetcher(), new CsvFileDataFetcher()));

        FetchException ex = assertThrows(FetchException.class, () -> registry.resolve("ftp"));
        assertTrue(ex.getMessage().contains("[csv, mock]"));
    }

    @Test
    void shouldRejectDuplicateSourceNames() {
        assertThrows(IllegalStateException.class,
                () -> new DataFetcherRegistry(List.of(new MockTransactionFetcher(), new MockTransactionFetcher())));
    }
}
