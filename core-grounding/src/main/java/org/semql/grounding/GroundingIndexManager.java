/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
*/

package org.semql.grounding;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicReference;

import org.semql.common.SemqlConfig;
import org.semql.metadata.catalog.ICatalogReader;
import org.semql.metadata.expression.ExpressionResolver;
import org.semql.metadata.model.ExploreGraph;
import org.semql.metadata.model.SemanticModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.RemovalListener;
import com.google.common.cache.RemovalNotification;
import com.google.common.collect.Lists;
import com.google.common.util.concurrent.UncheckedExecutionException;

/**
 * Holds the current {@link GroundingSnapshot}. A refresh builds a complete new snapshot
 * and swaps it in atomically, so readers never see a partially built one.
 * Indexes are cached by explore name and catalog fingerprint.
 */
public class GroundingIndexManager {

    private static final Logger logger = LoggerFactory.getLogger(GroundingIndexManager.class);

    private static final int MAX_CACHED_INDEXES = 256;

    private final SemanticModel model;
    private final ExpressionResolver resolver;
    private final boolean cacheEnabled;
    private final Cache<String, GroundingIndex> indexCache;// explore@fingerprint ==> index
    private final AtomicReference<GroundingSnapshot> current = new AtomicReference<GroundingSnapshot>();

    public GroundingIndexManager(SemanticModel model, SemqlConfig config) {
        this(model, new ExpressionResolver(config.getExpressionMaxDepth()), config.isGroundingCacheEnabled());
    }

    public GroundingIndexManager(SemanticModel model, ExpressionResolver resolver, boolean cacheEnabled) {
        this.model = model;
        this.resolver = resolver;
        this.cacheEnabled = cacheEnabled;
        this.indexCache = CacheBuilder.newBuilder().maximumSize(MAX_CACHED_INDEXES).removalListener(new RemovalListener<String, GroundingIndex>() {
            @Override
            public void onRemoval(RemovalNotification<String, GroundingIndex> notification) {
                logger.debug("Grounding index " + notification.getKey() + " is removed due to " + notification.getCause());
            }
        }).build();
    }

    /**
     * Rebuilds all indexes against {@code catalog} and publishes them as the current snapshot.
     */
    public GroundingSnapshot refresh(final ICatalogReader catalog) {
        final String fingerprint = catalog.getFingerprint();
        final GroundingIndexBuilder builder = new GroundingIndexBuilder(catalog, resolver);

        List<GroundingIndex> indexes = Lists.newArrayList();
        for (final ExploreGraph explore : model.getExplores()) {
            if (!cacheEnabled) {
                indexes.add(builder.build(explore));
                continue;
            }
            try {
                indexes.add(indexCache.get(explore.getName() + "@" + fingerprint, new Callable<GroundingIndex>() {
                    @Override
                    public GroundingIndex call() throws Exception {
                        return builder.build(explore);
                    }
                }));
            } catch (ExecutionException e) {
                throw new IllegalStateException("Failed to build grounding index of explore " + explore.getName(), e.getCause());
            } catch (UncheckedExecutionException e) {
                throw new IllegalStateException("Failed to build grounding index of explore " + explore.getName(), e.getCause());
            }
        }

        GroundingSnapshot snapshot = new GroundingSnapshot(fingerprint, indexes);
        GroundingSnapshot previous = current.getAndSet(snapshot);
        if (previous != null && !previous.getCatalogFingerprint().equals(fingerprint)) {
            invalidate(previous.getCatalogFingerprint());
        }
        logger.info("Published " + snapshot);
        return snapshot;
    }

    private void invalidate(String fingerprint) {
        List<String> stale = Lists.newArrayList();
        for (String key : indexCache.asMap().keySet()) {
            if (key.endsWith("@" + fingerprint))
                stale.add(key);
        }
        indexCache.invalidateAll(stale);
    }

    /**
     * @throws IllegalStateException if {@link #refresh(ICatalogReader)} was never called
     */
    public GroundingSnapshot getSnapshot() {
        GroundingSnapshot snapshot = current.get();
        if (snapshot == null)
            throw new IllegalStateException("Grounding indexes are not built yet, call refresh() first");
        return snapshot;
    }

    public GroundingIndex getIndex(String explore) {
        return getSnapshot().getIndex(explore);
    }

    public SemanticModel getModel() {
        return model;
    }

    public void wipeoutCache() {
        indexCache.invalidateAll();
    }

    long cachedIndexCount() {
        return indexCache.size();
    }
}
