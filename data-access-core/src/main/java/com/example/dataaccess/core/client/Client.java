package com.example.dataaccess.core.client;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Names the remote client an interface, or one of its methods, sends requests through. A method
 * annotation takes precedence over the annotation on its declaring interface.
 *
 * <pre>{@code
 * @Client("billing")
 * interface BillingApi {
 *   HttpResponse<String> invoices(String customerId);
 *
 *   @Client("billing-archive")
 *   HttpResponse<String> archivedInvoices(String customerId);
 * }
 * }</pre>
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE, ElementType.METHOD})
public @interface Client {
  /** Name of a client registered with {@link RemoteClients}. */
  String value();
}
