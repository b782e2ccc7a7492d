package dev.simpleemailapi.client;

import dev.simpleemailapi.core.Protocol;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link DomainsClient} backed by unary calls on an {@link EmailApiTransport}.
 */
final class TransportDomainsClient implements DomainsClient {

    record CreateDomainMessage(String name) {}
    record DomainIdMessage(String id) {}
    record DomainResponse(Domain domain) {}
    record ListDomainsResponse(List<Domain> domains) {}

    private final EmailApiTransport transport;

    TransportDomainsClient(EmailApiTransport transport) {
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    @Override
    public Domain create(String name) throws Exception {
        Objects.requireNonNull(name, "name");
        return domainOf(transport.unary(Protocol.CREATE_DOMAIN, new CreateDomainMessage(name), DomainResponse.class));
    }

    @Override
    public Domain get(String id) throws Exception {
        Objects.requireNonNull(id, "id");
        return domainOf(transport.unary(Protocol.GET_DOMAIN, new DomainIdMessage(id), DomainResponse.class));
    }

    @Override
    public List<Domain> list() throws Exception {
        ListDomainsResponse resp = transport.unary(Protocol.LIST_DOMAINS, Map.of(), ListDomainsResponse.class);
        if (resp == null || resp.domains() == null) {
            return List.of();
        }
        return List.copyOf(resp.domains());
    }

    @Override
    public Domain verify(String id) throws Exception {
        Objects.requireNonNull(id, "id");
        return domainOf(transport.unary(Protocol.VERIFY_DOMAIN, new DomainIdMessage(id), DomainResponse.class));
    }

    @Override
    public void delete(String id) throws Exception {
        Objects.requireNonNull(id, "id");
        transport.unary(Protocol.DELETE_DOMAIN, new DomainIdMessage(id), Void.class);
    }

    private static Domain domainOf(DomainResponse resp) {
        return resp == null ? null : resp.domain();
    }
}
