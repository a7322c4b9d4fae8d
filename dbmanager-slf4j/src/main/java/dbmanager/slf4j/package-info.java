/**
 * SLF4J adapter for the statement logging facade.
 */
package dbmanager.slf4j;
