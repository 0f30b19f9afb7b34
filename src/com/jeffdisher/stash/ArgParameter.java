package com.jeffdisher.stash;


/**
 * The description of a single command-line parameter.
 * Optional parameters carry a human-readable rendering of the value used when they are omitted (null if omitting
 * them just means "no constraint").
 */
public record ArgParameter(String name, ParameterType type, String description, String defaultValue)
{
	/**
	 * @param name The parameter name (typically something like "--param").
	 * @param type The type into which the parameter value should be parsed.
	 * @param description The human-readable description of what the parameter does.
	 * @return A parameter which must be given.
	 */
	public static ArgParameter required(String name, ParameterType type, String description)
	{
		return new ArgParameter(name, type, description, null);
	}

	/**
	 * @param name The parameter name.
	 * @param type The type into which the parameter value should be parsed.
	 * @param description The human-readable description of what the parameter does.
	 * @param defaultValue The rendering of the default (null if there is none).
	 * @return A parameter which may be omitted.
	 */
	public static ArgParameter optional(String name, ParameterType type, String description, String defaultValue)
	{
		return new ArgParameter(name, type, description, defaultValue);
	}

	/**
	 * @param arg A command-line token.
	 * @return True if the token names this parameter.
	 */
	public boolean isNamedBy(String arg)
	{
		return this.name.equals(arg);
	}

	/**
	 * @return The name and value type, for the usage line.
	 */
	public String shortDescription()
	{
		return this.name + " <" + this.type.shortDescription + ">";
	}

	/**
	 * @return The name, value type, description, and default, for the help text.
	 */
	public String longDescription()
	{
		String text = shortDescription() + " : " + this.description;
		if (null != this.defaultValue)
		{
			text += " (default " + this.defaultValue + ")";
		}
		return text;
	}
}
