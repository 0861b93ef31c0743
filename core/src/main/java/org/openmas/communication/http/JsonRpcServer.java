/*
 * Copyright 2025 Google LLC
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.openmas.communication.http;

import java.net.InetAddress;
import java.net.UnknownHostException;
import org.springframework.boot.web.embedded.tomcat.TomcatServletWebServerFactory;
import org.springframework.boot.web.servlet.context.AnnotationConfigServletWebServerApplicationContext;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.DispatcherServlet;
import org.springframework.web.servlet.config.annotation.EnableWebMvc;

/**
 * Embedded Spring MVC server hosting one {@link JsonRpcController}.
 *
 * <p>Each server owns its own application context, so several agents in one process can each
 * listen on their own port.
 */
final class JsonRpcServer implements AutoCloseable {

  private final AnnotationConfigServletWebServerApplicationContext context;

  private JsonRpcServer(AnnotationConfigServletWebServerApplicationContext context) {
    this.context = context;
  }

  /**
   * Starts a server bound to {@code host:port}. A zero port binds an ephemeral one.
   *
   * @throws UnknownHostException if {@code host} cannot be resolved.
   * @throws org.springframework.context.ApplicationContextException if the server cannot start.
   */
  static JsonRpcServer start(String host, int port, JsonRpcController controller)
      throws UnknownHostException {
    InetAddress address = InetAddress.getByName(host);
    AnnotationConfigServletWebServerApplicationContext context =
        new AnnotationConfigServletWebServerApplicationContext();
    context.registerBean(
        TomcatServletWebServerFactory.class,
        () -> {
          TomcatServletWebServerFactory factory = new TomcatServletWebServerFactory(port);
          factory.setAddress(address);
          return factory;
        });
    context.registerBean("dispatcherServlet", DispatcherServlet.class, () -> new DispatcherServlet());
    context.registerBean(JsonRpcController.class, () -> controller);
    context.register(WebConfig.class);
    try {
      context.refresh();
    } catch (RuntimeException e) {
      context.close();
      throw e;
    }
    return new JsonRpcServer(context);
  }

  /** The port the server is bound to. */
  int port() {
    return context.getWebServer().getPort();
  }

  @Override
  public void close() {
    context.close();
  }

  /** Turns on annotated controllers and the default message converters. */
  @Configuration(proxyBeanMethods = false)
  @EnableWebMvc
  static class WebConfig {}
}
