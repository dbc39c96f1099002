package io.b2mash.crmsync.integration.provider;

import io.b2mash.crmsync.integration.CrmType;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a {@link CrmProvider} bean as the adapter for one CRM type. {@link ProviderManager} scans
 * for this annotation at startup and fails fast on duplicates.
 *
 * <p>Adding a CRM:
 *
 * <ol>
 *   <li>add the value to {@link CrmType};
 *   <li>register its field mapping in {@code FieldMappingRegistry};
 *   <li>implement {@link CrmProvider} over {@link CrmHttp} and annotate the component with
 *       {@code @CrmAdapter(CrmType.X)}.
 * </ol>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface CrmAdapter {

  CrmType value();
}
