package com.packages.search.loader;

import com.packages.search.model.LoadingStatus;

import java.util.UUID;

/**
 * Observable state of a {@link PackageItemLoader}.
 *
 * @param loadingStatus composite loading state
 * @param operationId   correlation id of the current logical search
 * @param itemsCount    number of rows accumulated so far
 */
public record LoaderState(LoadingStatus loadingStatus, UUID operationId, int itemsCount) {

    LoaderState withStatus(final LoadingStatus status) {
        return new LoaderState(status, operationId, itemsCount);
    }
}
