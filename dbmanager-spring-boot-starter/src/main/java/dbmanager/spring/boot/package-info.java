/**
 * Spring Boot auto-configuration: a {@link dbmanager.DbManager} bean bound from
 * {@code dbmanager.*} properties, with an optional Micrometer exporter.
 */
package dbmanager.spring.boot;
