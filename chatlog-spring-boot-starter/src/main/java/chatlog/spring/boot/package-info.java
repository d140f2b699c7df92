/**
 * Spring Boot auto-configuration for the chat log.
 */
package chatlog.spring.boot;
