package com.shopgrid.catalogservice.client;

import com.shopgrid.common.dto.ShopResponse;

import java.util.List;

/**
 * Looks up the shops a user owns in the shop service.
 */
public interface ShopDirectoryClient {

    /**
     * Lists the shops owned by the subject, in the order the directory returns them.
     *
     * @param subjectId  owner to look up
     * @param credential the caller's bearer token, forwarded as is
     * @return a non-empty list of shops
     * @throws ShopDirectoryUnavailableException if the directory cannot be reached or answers with an error
     * @throws NoShopsFoundException             if the owner has no shops
     */
    List<ShopResponse> listOwnedShops(String subjectId, String credential);
}
