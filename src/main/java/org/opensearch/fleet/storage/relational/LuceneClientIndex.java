/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.storage.relational;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.core.WhitespaceAnalyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StringField;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.ReaderManager;
import org.apache.lucene.index.SerialMergeScheduler;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.Directory;
import org.opensearch.ExceptionsHelper;
import org.opensearch.fleet.index.ClientIndex;
import org.opensearch.fleet.model.ClientId;

import java.io.IOException;
import java.util.Arrays;
import java.util.Collection;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.UnaryOperator;

/**
 * Lucene-backed {@link ClientIndex}. Each client is one document holding its identifier and all of its keywords
 * as stored, untokenized terms; a lookup is a conjunction of term queries.
 *
 * <p>Writes replace the client's document and refresh the reader before returning, so lookups observe every
 * completed write.
 */
public class LuceneClientIndex implements ClientIndex {

    static final String CLIENT_ID_FIELD = "client_id";
    static final String KEYWORD_FIELD = "keyword";

    private final Analyzer analyzer;
    private final Directory directory;
    private final IndexWriter indexWriter;
    private final ReaderManager directoryReaderManager;

    /**
     * Creates a new index in the given directory.
     * @param directory directory holding the index; closed with the index
     */
    public LuceneClientIndex(Directory directory) {
        this.analyzer = new WhitespaceAnalyzer();
        this.directory = directory;
        try {
            IndexWriterConfig iwc = new IndexWriterConfig(analyzer);
            iwc.setMergeScheduler(new SerialMergeScheduler());
            indexWriter = new IndexWriter(directory, iwc);
            directoryReaderManager = new ReaderManager(DirectoryReader.open(indexWriter, true, false));
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize LuceneClientIndex", e);
        }
    }

    @Override
    public void addClient(ClientId clientId, Set<String> keywords) {
        updateKeywords(clientId, true, current -> {
            current.add(UNIVERSAL_KEYWORD);
            current.addAll(keywords);
            return current;
        });
    }

    @Override
    public SortedSet<ClientId> lookupClients(Collection<String> keywords) {
        BooleanQuery.Builder query = new BooleanQuery.Builder();
        for (String keyword : ClientIndex.effectiveKeywords(keywords)) {
            query.add(new TermQuery(new Term(KEYWORD_FIELD, keyword)), BooleanClause.Occur.FILTER);
        }

        DirectoryReader reader = null;
        try {
            reader = directoryReaderManager.acquire();
            IndexSearcher searcher = new IndexSearcher(reader);
            TopDocs topDocs = searcher.search(query.build(), Math.max(1, reader.maxDoc()));
            StoredFields storedFields = searcher.storedFields();
            SortedSet<ClientId> clients = new TreeSet<>();
            for (ScoreDoc scoreDoc : topDocs.scoreDocs) {
                clients.add(ClientId.fromString(storedFields.document(scoreDoc.doc).get(CLIENT_ID_FIELD)));
            }
            return clients;
        } catch (Exception e) {
            throw ExceptionsHelper.convertToRuntime(e);
        } finally {
            release(reader);
        }
    }

    @Override
    public void addClientLabels(ClientId clientId, Collection<String> labelNames) {
        updateKeywords(clientId, true, current -> {
            labelNames.forEach(name -> current.add(ClientIndex.labelKeyword(name)));
            return current;
        });
    }

    @Override
    public void removeClientLabels(ClientId clientId, Collection<String> labelNames) {
        updateKeywords(clientId, false, current -> {
            labelNames.forEach(name -> current.remove(ClientIndex.labelKeyword(name)));
            return current;
        });
    }

    /**
     * Read-modify-write of a client's keyword document. Serialized so concurrent updates of one client never
     * lose keywords.
     *
     * @param create whether to create the document if the client is not indexed yet
     */
    private synchronized void updateKeywords(ClientId clientId, boolean create, UnaryOperator<Set<String>> updater) {
        DirectoryReader reader = null;
        try {
            reader = directoryReaderManager.acquire();
            IndexSearcher searcher = new IndexSearcher(reader);
            Term idTerm = new Term(CLIENT_ID_FIELD, clientId.value());
            TopDocs existing = searcher.search(new TermQuery(idTerm), 1);
            if (existing.scoreDocs.length == 0 && create == false) {
                return;
            }
            Set<String> keywords = new TreeSet<>();
            if (existing.scoreDocs.length > 0) {
                Document current = searcher.storedFields().document(existing.scoreDocs[0].doc);
                keywords.addAll(Arrays.asList(current.getValues(KEYWORD_FIELD)));
            }
            Set<String> updated = updater.apply(keywords);

            Document doc = new Document();
            doc.add(new StringField(CLIENT_ID_FIELD, clientId.value(), Field.Store.YES));
            for (String keyword : updated) {
                doc.add(new StringField(KEYWORD_FIELD, keyword, Field.Store.YES));
            }
            indexWriter.updateDocument(idTerm, doc);
        } catch (Exception e) {
            throw ExceptionsHelper.convertToRuntime(e);
        } finally {
            release(reader);
        }
        refresh();
    }

    private void refresh() {
        try {
            directoryReaderManager.maybeRefreshBlocking();
        } catch (IOException e) {
            throw ExceptionsHelper.convertToRuntime(e);
        }
    }

    private void release(DirectoryReader reader) {
        if (reader != null) {
            try {
                directoryReaderManager.release(reader);
            } catch (IOException e) {
                throw new RuntimeException("Failed to release reader", e);
            }
        }
    }

    /**
     * Close the index
     * @throws IOException if closing fails
     */
    @Override
    public void close() throws IOException {
        directoryReaderManager.close();
        indexWriter.close();
        directory.close();
        analyzer.close();
    }
}
