/**
 * Spring Boot auto-configuration for the campus identity services.
 *
 * @see campus.spring.boot.CampusAutoConfiguration
 * @see campus.spring.boot.CampusProperties
 */
package campus.spring.boot;
