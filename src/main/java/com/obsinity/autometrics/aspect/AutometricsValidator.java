package com.obsinity.autometrics.aspect;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.LinkedHashSet;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.aop.support.AopUtils;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.beans.factory.config.BeanPostProcessor;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.core.annotation.AnnotationUtils;
import org.springframework.util.ReflectionUtils;

import com.obsinity.autometrics.annotations.Autometrics;
import com.obsinity.autometrics.config.InstrumentationConfigException;

/**
 * Plans every {@link Autometrics} method of each bean as the bean is created, so argument errors fail the bean's
 * creation instead of its first call, and logs the resulting metric-name catalog once the context is up.
 *
 * <p>Static and private methods cannot be proxied; an annotation on one is reported at WARN and ignored.
 */
public class AutometricsValidator implements BeanPostProcessor, SmartInitializingSingleton {

	private static final Logger log = LoggerFactory.getLogger(AutometricsValidator.class);

	private final ObjectProvider<InstrumentationRegistry> registry;

	public AutometricsValidator(ObjectProvider<InstrumentationRegistry> registry) {
		this.registry = registry;
	}

	@Override
	public Object postProcessAfterInitialization(Object bean, String beanName) throws BeansException {
		Class<?> userClass = AopUtils.getTargetClass(bean);
		if (!AnnotationUtils.isCandidateClass(userClass, Autometrics.class)) return bean;

		boolean typeLevel = AnnotatedElementUtils.hasAnnotation(userClass, Autometrics.class);
		for (Method m : instrumentableMethods(userClass, typeLevel, beanName)) {
			try {
				registry.getObject().planFor(m, userClass);
			} catch (InstrumentationConfigException e) {
				throw new BeanCreationException(beanName, err(userClass, m) + e.getMessage(), e);
			}
		}
		return bean;
	}

	@Override
	public void afterSingletonsInstantiated() {
		InstrumentationRegistry r = registry.getIfAvailable();
		if (r == null || r.size() == 0) return;
		log.info("autometrics instrumented {} method(s)", r.size());
		for (InstrumentedMethod p : r.catalog()) {
			log.info("autometrics {} counter={} histogram={} mode={} labels={}",
					p.path(), p.names().counterName(), p.names().histogramName(), p.mode(), p.labels());
		}
	}

	private static Set<Method> instrumentableMethods(Class<?> userClass, boolean typeLevel, String beanName) {
		Set<Method> out = new LinkedHashSet<>();
		ReflectionUtils.doWithMethods(userClass, m -> {
			boolean annotated = AnnotatedElementUtils.hasAnnotation(m, Autometrics.class);
			int mod = m.getModifiers();
			if (annotated && (Modifier.isStatic(mod) || Modifier.isPrivate(mod))) {
				log.warn("{}@Autometrics ignored on a {} method (bean '{}')",
						err(userClass, m), Modifier.isStatic(mod) ? "static" : "private", beanName);
				return;
			}
			if (annotated) {
				out.add(m);
			} else if (typeLevel && Modifier.isPublic(mod) && !Modifier.isStatic(mod)
					&& m.getDeclaringClass() == userClass && !isObjectContract(m)) {
				out.add(m);
			}
		}, m -> !m.isBridge() && !m.isSynthetic() && m.getDeclaringClass() != Object.class);
		return out;
	}

	private static boolean isObjectContract(Method m) {
		return ReflectionUtils.isToStringMethod(m) || ReflectionUtils.isHashCodeMethod(m)
				|| ReflectionUtils.isEqualsMethod(m);
	}

	private static String err(Class<?> type, Method m) {
		return type.getName() + "#" + m.getName() + ": ";
	}
}
