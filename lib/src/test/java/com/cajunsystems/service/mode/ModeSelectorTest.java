package com.cajunsystems.service.mode;

import com.cajunsystems.service.ServiceHandle;
import com.cajunsystems.service.TestServices;
import com.cajunsystems.service.config.ServiceConfig;
import com.cajunsystems.service.declaration.DeclarationParser;
import com.cajunsystems.service.declaration.FunctionKey;
import com.cajunsystems.service.declaration.ServiceDeclaration;
import com.cajunsystems.service.declaration.ServiceMode;
import com.cajunsystems.service.generator.ImplementationGenerator;
import com.cajunsystems.service.registry.ServiceRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ModeSelectorTest {

    private final ModeSelector selector = new ModeSelector();

    private ServiceStrategy<Integer> select(Map<String, Object> options) {
        ServiceDeclaration<Integer> declaration = TestServices.counter("selected")
                .withOptions(options)
                .build()
                .declaration();
        ServiceContext<Integer> context = new ServiceContext<>(declaration.name(), declaration.spec(),
                new ImplementationGenerator().generate(declaration), new ServiceConfig(), new ServiceRegistry(), List.of());
        return selector.select(context);
    }

    @Test
    void testSelectsStrategyPerMode() {
        assertInstanceOf(InlineStrategy.class, select(Map.of(DeclarationParser.MODE, "none")));
        assertInstanceOf(AnonymousStrategy.class, select(Map.of(DeclarationParser.MODE, "anonymous")));
        assertInstanceOf(NamedStrategy.class, select(Map.of(DeclarationParser.MODE, "named",
                DeclarationParser.SERVICE_NAME, "selected")));
        assertInstanceOf(PooledStrategy.class, select(Map.of(DeclarationParser.MODE, "pooled")));
    }

    @Test
    void testInlineHandleThreadsStateOnCallerThread() {
        ServiceStrategy<Integer> strategy = select(Map.of(DeclarationParser.MODE, ServiceMode.INLINE));

        ServiceHandle<Integer> handle = strategy.start(5);

        InlineHandle<Integer> inline = assertInstanceOf(InlineHandle.class, handle);
        assertEquals("selected#1", inline.id());
        assertEquals(6, handle.call(FunctionKey.of("increment", 0), List.of(), Duration.ofSeconds(1)));
        assertEquals(6, inline.state());
    }

    @Test
    void testAnonymousAndPooledHaveNoImplicitHandle() {
        assertThrows(IllegalStateException.class,
                () -> select(Map.of(DeclarationParser.MODE, "anonymous")).implicitHandle());
        assertThrows(IllegalStateException.class,
                () -> select(Map.of(DeclarationParser.MODE, "pooled")).implicitHandle());
    }
}
