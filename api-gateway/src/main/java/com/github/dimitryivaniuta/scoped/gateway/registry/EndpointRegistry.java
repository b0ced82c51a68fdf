package com.github.dimitryivaniuta.scoped.gateway.registry;

import com.github.dimitryivaniuta.scoped.core.endpoint.EndpointDescriptor;
import com.github.dimitryivaniuta.scoped.core.endpoint.EndpointOperation;
import com.github.dimitryivaniuta.scoped.core.endpoint.StandardOperation;
import com.github.dimitryivaniuta.scoped.core.scope.ScopeCatalog;
import com.github.dimitryivaniuta.scoped.core.scope.ScopeDiscovery;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.stereotype.Component;
import org.springframework.util.ClassUtils;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.reactive.result.method.RequestMappingInfo;
import org.springframework.web.reactive.result.method.annotation.RequestMappingHandlerMapping;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

/**
 * Registry of scoped endpoints, built once from the WebFlux handler mappings after all
 * controllers are instantiated.
 *
 * <p>Each controller is one endpoint; its operations are collected from its handlers.
 * A handler with its own required scope becomes a separate endpoint. The resulting
 * descriptors feed both scope discovery and request-time lookup.</p>
 */
@Slf4j
@Component
public class EndpointRegistry implements SmartInitializingSingleton {

    private final RequestMappingHandlerMapping handlerMapping;

    private final ScopeDiscovery discovery;

    private volatile Map<Method, EndpointBinding> bindings = Map.of();

    private volatile List<EndpointDescriptor> endpoints = List.of();

    private volatile ScopeCatalog catalog = ScopeCatalog.empty();

    public EndpointRegistry(@Qualifier("requestMappingHandlerMapping") final RequestMappingHandlerMapping handlerMapping,
                            final ScopeDiscovery discovery) {
        this.handlerMapping = handlerMapping;
        this.discovery = discovery;
    }

    @Override
    public void afterSingletonsInstantiated() {
        register(handlerMapping.getHandlerMethods());
    }

    void register(final Map<RequestMappingInfo, HandlerMethod> handlerMethods) {
        List<Map.Entry<RequestMappingInfo, HandlerMethod>> entries = new ArrayList<>(handlerMethods.entrySet());
        entries.sort(Comparator
                .comparing((Map.Entry<RequestMappingInfo, HandlerMethod> e) -> controllerType(e.getValue()).getName())
                .thenComparing(e -> e.getValue().getMethod().getName())
                .thenComparing(e -> e.getKey().toString()));

        Map<Class<?>, EndpointDescriptor.EndpointDescriptorBuilder> controllers = new LinkedHashMap<>();
        List<Handler> handlers = new ArrayList<>();

        for (Map.Entry<RequestMappingInfo, HandlerMethod> entry : entries) {
            Class<?> type = controllerType(entry.getValue());
            Method method = entry.getValue().getMethod();
            if (isExempt(type, method)) {
                log.debug("Scope exempt handler={}#{}", type.getSimpleName(), method.getName());
                continue;
            }

            ScopedOperation declared = AnnotatedElementUtils.findMergedAnnotation(method, ScopedOperation.class);
            EndpointOperation operation = declaredOperation(declared);
            String ownScope = declared == null ? null : emptyToNull(declared.requiredScope());

            EndpointDescriptor.EndpointDescriptorBuilder controller =
                    controllers.computeIfAbsent(type, EndpointRegistry::describe);
            if (ownScope == null) {
                addOperations(controller, operation, entry.getKey());
            }
            handlers.add(new Handler(type, method, entry.getKey(), operation, ownScope));
        }

        Map<Class<?>, EndpointDescriptor> built = new LinkedHashMap<>();
        controllers.forEach((type, builder) -> built.put(type, builder.build()));

        List<EndpointDescriptor> all = new ArrayList<>(built.values());
        Map<Method, EndpointBinding> byMethod = new HashMap<>();
        for (Handler h : handlers) {
            EndpointDescriptor endpoint = built.get(h.type());
            if (h.requiredScope() != null) {
                EndpointDescriptor.EndpointDescriptorBuilder own = endpoint.toBuilder()
                        .requiredScope(h.requiredScope())
                        .clearStandardOperations()
                        .clearCustomOperations();
                addOperations(own, h.operation(), h.info());
                endpoint = own.build();
                all.add(endpoint);
            }
            byMethod.put(h.method(), new EndpointBinding(endpoint, h.operation()));
        }

        this.bindings = Collections.unmodifiableMap(byMethod);
        this.endpoints = List.copyOf(all);
        this.catalog = discovery.discover(all);
        log.info("Scoped endpoints registered handlers={} endpoints={} resources={} scopes={}",
                byMethod.size(), all.size(), catalog.resourceCount(), catalog.scopeCount());
    }

    /**
     * Binding of the handler that will serve this exchange.
     *
     * @return binding, or empty when the exchange maps to no registered handler
     */
    public Mono<EndpointBinding> resolve(final ServerWebExchange exchange) {
        return handlerMapping.getHandler(exchange)
                .ofType(HandlerMethod.class)
                .mapNotNull(hm -> bindings.get(hm.getMethod()))
                .onErrorResume(e -> {
                    // the dispatcher reports mapping errors (405, 415) itself
                    log.trace("No handler for {} {}: {}", exchange.getRequest().getMethod(),
                            exchange.getRequest().getPath(), e.toString());
                    return Mono.empty();
                });
    }

    public List<EndpointDescriptor> endpoints() {
        return endpoints;
    }

    public ScopeCatalog catalog() {
        return catalog;
    }

    private static EndpointDescriptor.EndpointDescriptorBuilder describe(final Class<?> type) {
        ScopedResource resource = AnnotatedElementUtils.findMergedAnnotation(type, ScopedResource.class);
        EndpointDescriptor.EndpointDescriptorBuilder builder = EndpointDescriptor.builder()
                .implementation(type.getName())
                .module(moduleOf(type));
        if (resource != null) {
            if (!resource.module().isEmpty()) builder.module(resource.module());
            builder.resourceName(emptyToNull(resource.name()))
                    .requiredScope(emptyToNull(resource.requiredScope()));
            for (String custom : resource.customOperations()) {
                builder.customOperation(custom);
            }
        }
        return builder;
    }

    private static EndpointOperation declaredOperation(final ScopedOperation declared) {
        if (declared == null) return null;
        if (!declared.custom().isEmpty()) return EndpointOperation.custom(declared.custom());
        if (declared.value().length > 0) return EndpointOperation.standard(declared.value()[0]);
        return null;
    }

    private static void addOperations(final EndpointDescriptor.EndpointDescriptorBuilder builder,
                                      final EndpointOperation operation,
                                      final RequestMappingInfo info) {
        if (operation != null) {
            if (operation.kind().isStandard()) {
                StandardOperation.fromName(operation.name()).ifPresent(builder::standardOperation);
            } else {
                builder.customOperation(operation.name());
            }
            return;
        }
        Set<RequestMethod> methods = info.getMethodsCondition().getMethods();
        if (methods.isEmpty()) {
            builder.standardOperation(StandardOperation.LIST);
            return;
        }
        for (RequestMethod m : methods) {
            StandardOperation.forHttpMethod(m.name()).ifPresent(builder::standardOperation);
        }
    }

    private static boolean isExempt(final Class<?> type, final Method method) {
        return AnnotatedElementUtils.hasAnnotation(type, ScopeExempt.class)
                || AnnotatedElementUtils.hasAnnotation(method, ScopeExempt.class);
    }

    private static Class<?> controllerType(final HandlerMethod hm) {
        return ClassUtils.getUserClass(hm.getBeanType());
    }

    /** Last package segment, e.g. {@code com.acme.blog.PostController} is in module {@code blog}. */
    static String moduleOf(final Class<?> type) {
        String pkg = ClassUtils.getPackageName(type);
        if (pkg.isEmpty()) return EndpointDescriptor.DEFAULT_MODULE;
        return pkg.substring(pkg.lastIndexOf('.') + 1);
    }

    private static String emptyToNull(final String s) {
        return s == null || s.isEmpty() ? null : s;
    }

    private record Handler(Class<?> type, Method method, RequestMappingInfo info,
                           EndpointOperation operation, String requiredScope) {
    }
}
