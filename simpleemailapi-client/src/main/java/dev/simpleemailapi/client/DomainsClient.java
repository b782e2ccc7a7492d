package dev.simpleemailapi.client;

import java.util.List;

/**
 * Domain management operations.
 */
public interface DomainsClient {
    Domain create(String name) throws Exception;
    Domain get(String id) throws Exception;
    List<Domain> list() throws Exception;
    Domain verify(String id) throws Exception;
    void delete(String id) throws Exception;
}
