package com.example.streampanel.support;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

public final class MeterProviders {

    private MeterProviders() {
    }

    public static ObjectProvider<MeterRegistry> of(MeterRegistry meterRegistry) {
        StaticListableBeanFactory beanFactory = new StaticListableBeanFactory();
        beanFactory.addBean("meterRegistry", meterRegistry);
        return beanFactory.getBeanProvider(MeterRegistry.class);
    }

    public static ObjectProvider<MeterRegistry> none() {
        return new StaticListableBeanFactory().getBeanProvider(MeterRegistry.class);
    }
}
