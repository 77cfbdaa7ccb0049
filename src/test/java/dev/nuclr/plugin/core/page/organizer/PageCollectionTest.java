package dev.nuclr.plugin.core.page.organizer;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PageCollectionTest {

    private ExecutorService renderPool;
    private RecordingRenderBackend backend;
    private PageThumbnailCache cache;
    private SourceDocumentRegistry registry;
    private PageCollection collection;

    @BeforeEach
    void setUp() {
        renderPool = Executors.newFixedThreadPool(4);
        backend = new RecordingRenderBackend();
        cache = new PageThumbnailCache(100, 50L * 1024 * 1024);
        registry = new SourceDocumentRegistry();
        ThumbnailPipeline pipeline = new ThumbnailPipeline(
                backend, cache, ThumbnailSize.DEFAULT, 5, 0, renderPool);
        collection = new PageCollection(pipeline, cache, registry);
    }

    @AfterEach
    void tearDown() {
        collection.clear();
        renderPool.shutdownNow();
    }

    private static List<UUID> ids(List<PageEntry> pages) {
        List<UUID> ids = new ArrayList<>();
        for (PageEntry p : pages) ids.add(p.id());
        return ids;
    }

    private static void assertContiguousIndexes(List<PageEntry> pages) {
        for (int i = 0; i < pages.size(); i++) {
            assertEquals(i + 1, pages.get(i).displayIndex(), "display index at position " + i);
        }
    }

    private List<UUID> addFive() {
        List<UUID> all = new ArrayList<>(collection.addSource(TestDocuments.source("report", 3)));
        all.addAll(collection.addSource(TestDocuments.source("appendix", 2)));
        return all;
    }

    @Test
    void addSource_twoSources_appendsPagesInOrderWithContinuousIndexes() {
        SourceDocument report = TestDocuments.source("report", 3);
        SourceDocument appendix = TestDocuments.source("appendix", 2);

        List<UUID> first = collection.addSource(report);
        List<UUID> second = collection.addSource(appendix);

        List<PageEntry> pages = collection.pages();
        assertEquals(5, pages.size());
        assertContiguousIndexes(pages);
        assertEquals(List.of("report", "report", "report", "appendix", "appendix"),
                pages.stream().map(PageEntry::sourceLabel).toList());
        assertEquals(List.of(0, 1, 2, 0, 1),
                pages.stream().map(PageEntry::originIndex).toList());
        assertEquals(first, ids(pages).subList(0, 3));
        assertEquals(second, ids(pages).subList(3, 5));
        assertEquals(2, collection.documentCount());
        assertEquals(2, registry.size());
    }

    @Test
    void addSource_sourceWithoutPages_addsNothingAndIsNotRetained() {
        SourceDocument empty = new SourceDocument("empty", new PDDocument());

        assertTrue(collection.addSource(empty).isEmpty());
        assertTrue(collection.isEmpty());
        assertEquals(0, registry.size());
        empty.close();
    }

    @Test
    void addSource_publishesThumbnailsForNewPages() throws Exception {
        addFive();

        collection.thumbnailsSettled().get(5, TimeUnit.SECONDS);

        for (PageEntry page : collection.pages()) {
            assertTrue(page.hasThumbnail(), "page " + page.displayIndex() + " has a thumbnail");
            assertEquals(140, page.thumbnail().getWidth());
        }
        assertEquals(5, backend.renderCount());
        assertEquals(0, collection.pendingRenderCount());
    }

    @Test
    void delete_pagesOfSecondSource_keepsFirstSourceInOrderAndFreesSecond() throws Exception {
        SourceDocument report = TestDocuments.source("report", 3);
        SourceDocument appendix = TestDocuments.source("appendix", 2);
        List<UUID> first = collection.addSource(report);
        List<UUID> second = collection.addSource(appendix);
        collection.thumbnailsSettled().get(5, TimeUnit.SECONDS);

        int removed = collection.delete(new HashSet<>(second));

        assertEquals(2, removed);
        List<PageEntry> pages = collection.pages();
        assertEquals(first, ids(pages));
        assertContiguousIndexes(pages);
        assertEquals(1, collection.documentCount());
        assertEquals(1, registry.size());
        assertTrue(appendix.isClosed());
        assertFalse(report.isClosed());
        assertEquals(3, cache.size());
    }

    @Test
    void delete_whileRendersInFlight_lateThumbnailsNeverReappear() throws Exception {
        RecordingRenderBackend gated = new RecordingRenderBackend(true);
        PageThumbnailCache gatedCache = new PageThumbnailCache(100, 50L * 1024 * 1024);
        SourceDocumentRegistry gatedRegistry = new SourceDocumentRegistry();
        PageCollection pages = new PageCollection(
                new ThumbnailPipeline(gated, gatedCache, ThumbnailSize.DEFAULT, 5, 0, renderPool),
                gatedCache, gatedRegistry);
        SourceDocument report = TestDocuments.source("report", 2);
        SourceDocument appendix = TestDocuments.source("appendix", 2);

        List<UUID> ids = pages.addSources(List.of(report, appendix));
        gated.awaitInFlight(4);
        pages.delete(Set.of(ids.get(2), ids.get(3)));
        assertTrue(appendix.isClosed());

        gated.release();
        pages.thumbnailsSettled().get(5, TimeUnit.SECONDS);

        assertEquals(ids.subList(0, 2), ids(pages.pages()));
        assertTrue(pages.pages().stream().allMatch(PageEntry::hasThumbnail));
        assertEquals(0, pages.pendingRenderCount());
        assertEquals(2, gatedCache.size());
        assertNull(gatedCache.get(new PageThumbnailCache.Key(appendix.id(), 0, 140, 180)));
        assertNull(gatedCache.get(new PageThumbnailCache.Key(appendix.id(), 1, 140, 180)));
        assertEquals(1, gatedRegistry.size());
        pages.clear();
    }

    @Test
    void addSources_appendsInOrderAndSkipsEmptySources() throws Exception {
        SourceDocument empty = new SourceDocument("empty", new PDDocument());
        List<UUID> ids = collection.addSources(List.of(
                TestDocuments.source("report", 3), empty, TestDocuments.source("appendix", 4)));

        assertEquals(7, ids.size());
        assertEquals(ids, ids(collection.pages()));
        assertContiguousIndexes(collection.pages());
        assertEquals(2, registry.size());

        collection.thumbnailsSettled().get(5, TimeUnit.SECONDS);
        assertEquals(7, backend.renderCount());
        empty.close();
    }

    @Test
    void delete_allPagesSelected_isRejectedAndChangesNothing() {
        List<UUID> before = addFive();
        collection.selectAll();

        InvalidSelectionException ex = assertThrows(InvalidSelectionException.class,
                () -> collection.deleteSelected());

        assertEquals(InvalidSelectionException.Reason.ALL_PAGES_SELECTED, ex.getReason());
        assertEquals(before, ids(collection.pages()));
        assertEquals(5, collection.selection().size());
    }

    @Test
    void delete_emptySelection_isRejectedAndChangesNothing() {
        List<UUID> before = addFive();

        InvalidSelectionException ex = assertThrows(InvalidSelectionException.class,
                () -> collection.delete(Set.of()));

        assertEquals(InvalidSelectionException.Reason.EMPTY_SELECTION, ex.getReason());
        assertEquals(before, ids(collection.pages()));
    }

    @Test
    void delete_removesIdsFromSelection() throws Exception {
        List<UUID> ids = addFive();
        collection.select(ids.get(0));
        collection.select(ids.get(1));
        collection.select(ids.get(4));

        collection.delete(Set.of(ids.get(0), ids.get(4)));

        assertEquals(Set.of(ids.get(1)), collection.selection());
        assertFalse(collection.get(ids.get(0)).isPresent());
    }

    @Test
    void delete_unknownIdsOnly_removesNothing() throws Exception {
        addFive();

        assertEquals(0, collection.delete(Set.of(UUID.randomUUID())));
        assertEquals(5, collection.size());
    }

    @Test
    void removeOne_lastPage_emptiesCollection() {
        List<UUID> ids = collection.addSource(TestDocuments.source("single", 1));

        assertTrue(collection.removeOne(ids.get(0)));

        assertTrue(collection.isEmpty());
        assertEquals(0, collection.documentCount());
        assertFalse(collection.removeOne(ids.get(0)));
    }

    @Test
    void move_adjacentRoundTrip_restoresOrder() {
        List<UUID> ids = addFive();
        UUID a = ids.get(1);
        UUID b = ids.get(2);

        collection.move(a, b);
        assertEquals(List.of(ids.get(0), b, a, ids.get(3), ids.get(4)), ids(collection.pages()));

        collection.move(b, a);
        assertEquals(ids, ids(collection.pages()));
        assertContiguousIndexes(collection.pages());
    }

    @Test
    void move_nonAdjacent_removesThenInsertsAtTargetIndex() {
        List<UUID> ids = addFive();
        UUID a = ids.get(0), b = ids.get(1), c = ids.get(2), d = ids.get(3), e = ids.get(4);

        collection.move(a, d);
        assertEquals(List.of(b, c, d, a, e), ids(collection.pages()));

        collection.move(d, a);
        assertEquals(List.of(b, c, a, d, e), ids(collection.pages()));

        collection.move(e, b);
        assertEquals(List.of(e, b, c, a, d), ids(collection.pages()));
        assertContiguousIndexes(collection.pages());
    }

    @Test
    void move_withAbsentId_isNoOp() {
        List<UUID> ids = addFive();

        collection.move(ids.get(0), UUID.randomUUID());
        collection.move(UUID.randomUUID(), ids.get(0));
        collection.move(ids.get(2), ids.get(2));

        assertEquals(ids, ids(collection.pages()));
    }

    @Test
    void move_keepsThumbnails() throws Exception {
        List<UUID> ids = addFive();
        collection.thumbnailsSettled().get(5, TimeUnit.SECONDS);

        collection.move(ids.get(4), ids.get(0));

        assertTrue(collection.pages().stream().allMatch(PageEntry::hasThumbnail));
        assertEquals(5, backend.renderCount());
    }

    @Test
    void reverse_twice_restoresOriginalOrder() {
        List<UUID> ids = addFive();

        collection.reverse();
        List<UUID> reversed = new ArrayList<>(ids);
        java.util.Collections.reverse(reversed);
        assertEquals(reversed, ids(collection.pages()));
        assertContiguousIndexes(collection.pages());

        collection.reverse();
        assertEquals(ids, ids(collection.pages()));
    }

    @Test
    void displayIndexes_stayContiguous_underRandomOperations() {
        Random random = new Random(42);
        for (int step = 0; step < 300; step++) {
            List<UUID> ids = ids(collection.pages());
            switch (random.nextInt(5)) {
                case 0 -> collection.addSource(TestDocuments.source("doc" + step, 1 + random.nextInt(3)));
                case 1 -> {
                    Set<UUID> victims = new HashSet<>();
                    for (UUID id : ids) if (random.nextInt(3) == 0) victims.add(id);
                    try {
                        collection.delete(victims);
                    } catch (InvalidSelectionException expected) {
                        assertEquals(ids, ids(collection.pages()));
                    }
                }
                case 2 -> {
                    if (!ids.isEmpty()) {
                        collection.move(ids.get(random.nextInt(ids.size())), ids.get(random.nextInt(ids.size())));
                    }
                }
                case 3 -> collection.reverse();
                default -> {
                    if (!ids.isEmpty()) collection.removeOne(ids.get(random.nextInt(ids.size())));
                }
            }
            List<PageEntry> pages = collection.pages();
            assertContiguousIndexes(pages);
            assertEquals(pages.size(), new HashSet<>(ids(pages)).size());
        }
    }

    @Test
    void select_absentId_isNoOp() {
        addFive();

        collection.select(UUID.randomUUID());
        collection.deselect(UUID.randomUUID());

        assertTrue(collection.selection().isEmpty());
    }

    @Test
    void toggleSelection_flipsMembership() {
        List<UUID> ids = addFive();

        collection.toggleSelection(ids.get(3));
        assertTrue(collection.isSelected(ids.get(3)));

        collection.toggleSelection(ids.get(3));
        assertFalse(collection.isSelected(ids.get(3)));
    }

    @Test
    void selectAll_thenClearSelection() {
        List<UUID> ids = addFive();

        collection.selectAll();
        assertEquals(new HashSet<>(ids), collection.selection());

        collection.clearSelection();
        assertTrue(collection.selection().isEmpty());
    }

    @Test
    void clear_dropsPagesSelectionSourcesAndCache() throws Exception {
        List<UUID> ids = addFive();
        collection.thumbnailsSettled().get(5, TimeUnit.SECONDS);
        collection.select(ids.get(0));
        assertEquals(5, cache.size());

        collection.clear();

        assertTrue(collection.isEmpty());
        assertTrue(collection.selection().isEmpty());
        assertEquals(0, registry.size());
        assertEquals(0, cache.size());
        assertEquals(0, collection.pendingRenderCount());
        assertEquals(0, collection.documentCount());
    }

    @Test
    void changeListeners_areNotifiedAndIsolatedFromFailures() {
        AtomicInteger calls = new AtomicInteger();
        collection.addChangeListener(() -> {
            throw new IllegalStateException("listener bug");
        });
        collection.addChangeListener(calls::incrementAndGet);

        List<UUID> ids = collection.addSource(TestDocuments.source("report", 2));
        int afterAdd = calls.get();
        collection.reverse();
        collection.select(ids.get(0));

        assertTrue(afterAdd >= 1);
        assertTrue(calls.get() >= afterAdd + 2);
    }
}
